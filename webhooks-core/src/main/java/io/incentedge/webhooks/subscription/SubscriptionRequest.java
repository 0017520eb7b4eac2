package io.incentedge.webhooks.subscription;

import io.incentedge.webhooks.filter.FilterCriteria;

import java.util.List;
import java.util.Map;

/**
 * Input for {@link SubscriptionManager#create}. {@code active} defaults to {@code true} and
 * {@code maxRetries} to {@code 3} when {@code null}.
 */
public record SubscriptionRequest(
    String name,
    String description,
    String url,
    List<String> events,
    FilterCriteria filters,
    Map<String, String> customHeaders,
    Boolean active,
    Integer maxRetries
) {
  public static SubscriptionRequest of(String name, String url, List<String> events) {
    return new SubscriptionRequest(name, null, url, events, null, null, null, null);
  }
}
