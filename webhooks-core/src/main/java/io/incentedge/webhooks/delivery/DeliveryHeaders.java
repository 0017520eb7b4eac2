package io.incentedge.webhooks.delivery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Names and assembly of the protocol headers sent with every webhook request.
 *
 * <p>For product {@code IncentEdge} the headers are {@code User-Agent: IncentEdge-Webhook/1.0},
 * {@code X-IncentEdge-Signature}, {@code X-IncentEdge-Event} and {@code X-IncentEdge-Delivery}.
 */
public final class DeliveryHeaders {
  public static final String DEFAULT_PRODUCT_NAME = "IncentEdge";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String USER_AGENT = "User-Agent";
  public static final String JSON = "application/json";

  private final String userAgent;
  private final String signatureHeader;
  private final String eventHeader;
  private final String deliveryHeader;

  public DeliveryHeaders(String productName) {
    Objects.requireNonNull(productName, "productName");
    if (productName.isBlank() || !productName.matches("[A-Za-z0-9-]+")) {
      throw new IllegalArgumentException("productName must be a header token, got: " + productName);
    }
    this.userAgent = productName + "-Webhook/1.0";
    this.signatureHeader = "X-" + productName + "-Signature";
    this.eventHeader = "X-" + productName + "-Event";
    this.deliveryHeader = "X-" + productName + "-Delivery";
  }

  public String userAgent() {
    return userAgent;
  }

  public String signatureHeader() {
    return signatureHeader;
  }

  public String eventHeader() {
    return eventHeader;
  }

  public String deliveryHeader() {
    return deliveryHeader;
  }

  /**
   * Merges a subscription's custom headers with the protocol headers. A custom header whose
   * name equals a protocol header (ignoring case) is dropped.
   *
   * @return headers in send order, custom headers first
   */
  public Map<String, String> build(Map<String, String> customHeaders, String signature,
      String eventType, String deliveryId) {
    Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (customHeaders != null) {
      customHeaders.forEach((name, value) -> {
        if (name != null && value != null) {
          merged.put(name, value);
        }
      });
    }
    Map<String, String> protocol = new LinkedHashMap<>();
    protocol.put(CONTENT_TYPE, JSON);
    protocol.put(USER_AGENT, userAgent);
    protocol.put(signatureHeader, signature);
    protocol.put(eventHeader, eventType);
    protocol.put(deliveryHeader, deliveryId);
    protocol.keySet().forEach(merged::remove);

    Map<String, String> ordered = new LinkedHashMap<>(merged);
    ordered.putAll(protocol);
    return Collections.unmodifiableMap(ordered);
  }
}
