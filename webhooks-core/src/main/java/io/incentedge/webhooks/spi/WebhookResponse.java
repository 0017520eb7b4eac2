package io.incentedge.webhooks.spi;

import java.util.Map;

/**
 * A receiver's answer to a webhook POST.
 *
 * @param statusCode HTTP status
 * @param headers    response headers, first value per name
 * @param body       response body decoded as UTF-8, possibly empty
 */
public record WebhookResponse(int statusCode, Map<String, String> headers, String body) {
  public WebhookResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    body = body == null ? "" : body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
