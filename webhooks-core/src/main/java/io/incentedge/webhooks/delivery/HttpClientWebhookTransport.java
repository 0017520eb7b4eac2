package io.incentedge.webhooks.delivery;

import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.spi.WebhookRequest;
import io.incentedge.webhooks.spi.WebhookResponse;
import io.incentedge.webhooks.spi.WebhookTransport;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link WebhookTransport} on the JDK {@link HttpClient}.
 *
 * <p>The request timeout only bounds the wait for response headers, so the exchange is also
 * awaited with the same deadline and cancelled when it elapses. Only the first
 * {@link DeliveryRecord#MAX_RESPONSE_BODY_CHARS} characters of a response body are read.
 * Redirects are not followed.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {
  private static final Logger logger = Logger.getLogger(HttpClientWebhookTransport.class.getName());

  /** Headers the JDK client manages itself and refuses to accept. */
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient client;

  public HttpClientWebhookTransport() {
    this(HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build());
  }

  public HttpClientWebhookTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public WebhookResponse send(WebhookRequest request) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
        .timeout(request.timeout())
        .POST(HttpRequest.BodyPublishers.ofByteArray(request.body()));
    request.headers().forEach((name, value) -> {
      if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        logger.log(Level.WARNING, "Dropping restricted header {0} for {1}",
            new Object[] {name, request.uri().getHost()});
      } else {
        builder.header(name, value);
      }
    });

    CompletableFuture<HttpResponse<String>> future =
        client.sendAsync(builder.build(), BoundedBodySubscriber.handler(DeliveryRecord.MAX_RESPONSE_BODY_CHARS));
    HttpResponse<String> response;
    try {
      response = future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new HttpTimeoutException("No complete response within " + request.timeout().toMillis() + "ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException(cause == null ? "Request failed" : cause.getMessage(), cause);
    }
    return new WebhookResponse(response.statusCode(), firstValues(response.headers().map()), response.body());
  }

  private static Map<String, String> firstValues(Map<String, List<String>> headers) {
    Map<String, String> result = new LinkedHashMap<>();
    headers.forEach((name, values) -> {
      // HTTP/2 pseudo-headers such as :status are not real headers
      if (!name.startsWith(":") && !values.isEmpty()) {
        result.put(name, values.get(0));
      }
    });
    return result;
  }
}
