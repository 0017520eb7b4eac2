package io.incentedge.webhooks.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound webhook POST. {@code body} holds the exact bytes that were signed.
 */
public record WebhookRequest(URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
  public WebhookRequest {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(timeout, "timeout");
    headers = headers == null
        ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  /** Case-insensitive header lookup. */
  public String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
