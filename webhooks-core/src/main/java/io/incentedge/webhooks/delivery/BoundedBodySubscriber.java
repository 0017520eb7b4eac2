package io.incentedge.webhooks.delivery;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Collects at most {@code maxChars} characters of a UTF-8 response body, then cancels the
 * rest of the stream so an endpoint cannot make a worker buffer an unbounded reply.
 */
final class BoundedBodySubscriber implements HttpResponse.BodySubscriber<String> {
  private final int maxChars;
  private final int maxBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final CompletableFuture<String> body = new CompletableFuture<>();
  private Flow.Subscription subscription;

  BoundedBodySubscriber(int maxChars) {
    if (maxChars < 0) {
      throw new IllegalArgumentException("maxChars must be >= 0");
    }
    this.maxChars = maxChars;
    // a UTF-8 character is at most 4 bytes
    this.maxBytes = Math.multiplyExact(maxChars, 4);
  }

  static HttpResponse.BodyHandler<String> handler(int maxChars) {
    return responseInfo -> new BoundedBodySubscriber(maxChars);
  }

  @Override
  public CompletionStage<String> getBody() {
    return body;
  }

  @Override
  public void onSubscribe(Flow.Subscription subscription) {
    this.subscription = subscription;
    subscription.request(Long.MAX_VALUE);
  }

  @Override
  public void onNext(List<ByteBuffer> items) {
    if (body.isDone()) {
      return;
    }
    for (ByteBuffer item : items) {
      int take = Math.min(item.remaining(), maxBytes - buffer.size());
      byte[] chunk = new byte[take];
      item.get(chunk);
      buffer.write(chunk, 0, take);
    }
    if (buffer.size() >= maxBytes) {
      body.complete(decode());
      subscription.cancel();
    }
  }

  @Override
  public void onError(Throwable throwable) {
    body.completeExceptionally(throwable);
  }

  @Override
  public void onComplete() {
    body.complete(decode());
  }

  private String decode() {
    String text = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }
}
