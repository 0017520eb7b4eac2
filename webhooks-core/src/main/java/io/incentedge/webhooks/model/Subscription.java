package io.incentedge.webhooks.model;

import io.incentedge.webhooks.filter.FilterCriteria;
import io.incentedge.webhooks.signature.WebhookSecrets;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A registered webhook endpoint belonging to one organization.
 *
 * <p>{@link #toString()} masks the secret; the secret itself is never logged.
 */
public final class Subscription {
  public static final int DEFAULT_MAX_RETRIES = 3;

  private final String id;
  private final String organizationId;
  private final String name;
  private final String description;
  private final String url;
  private final String secret;
  private final Set<String> events;
  private final FilterCriteria filters;
  private final Map<String, String> customHeaders;
  private final boolean active;
  private final int maxRetries;
  private final Instant lastTriggeredAt;
  private final Instant lastSuccessAt;
  private final Instant lastFailureAt;
  private final long successCount;
  private final long failureCount;
  private final Instant createdAt;

  private Subscription(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId");
    this.name = Objects.requireNonNull(builder.name, "name");
    this.description = builder.description;
    this.url = Objects.requireNonNull(builder.url, "url");
    this.secret = Objects.requireNonNull(builder.secret, "secret");
    this.events = Collections.unmodifiableSet(new LinkedHashSet<>(builder.events));
    this.filters = builder.filters == null ? FilterCriteria.EMPTY : builder.filters;
    this.customHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customHeaders));
    this.active = builder.active;
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    this.maxRetries = builder.maxRetries;
    this.lastTriggeredAt = builder.lastTriggeredAt;
    this.lastSuccessAt = builder.lastSuccessAt;
    this.lastFailureAt = builder.lastFailureAt;
    this.successCount = builder.successCount;
    this.failureCount = builder.failureCount;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .organizationId(organizationId)
        .name(name)
        .description(description)
        .url(url)
        .secret(secret)
        .events(events)
        .filters(filters)
        .customHeaders(customHeaders)
        .active(active)
        .maxRetries(maxRetries)
        .lastTriggeredAt(lastTriggeredAt)
        .lastSuccessAt(lastSuccessAt)
        .lastFailureAt(lastFailureAt)
        .successCount(successCount)
        .failureCount(failureCount)
        .createdAt(createdAt);
  }

  public String id() {
    return id;
  }

  public String organizationId() {
    return organizationId;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public String url() {
    return url;
  }

  public String secret() {
    return secret;
  }

  /** Subscribed event-type wire names. */
  public Set<String> events() {
    return events;
  }

  public boolean subscribesTo(String eventType) {
    return events.contains(eventType);
  }

  public FilterCriteria filters() {
    return filters;
  }

  public Map<String, String> customHeaders() {
    return customHeaders;
  }

  public boolean active() {
    return active;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /** Total attempts allowed per delivery: the first try plus {@link #maxRetries()}. */
  public int maxAttempts() {
    return maxRetries + 1;
  }

  public Instant lastTriggeredAt() {
    return lastTriggeredAt;
  }

  public Instant lastSuccessAt() {
    return lastSuccessAt;
  }

  public Instant lastFailureAt() {
    return lastFailureAt;
  }

  public long successCount() {
    return successCount;
  }

  public long failureCount() {
    return failureCount;
  }

  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Subscription other)) return false;
    return id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", organizationId=" + organizationId + ", name=" + name
        + ", url=" + url + ", secret=" + WebhookSecrets.mask(secret) + ", events=" + events
        + ", active=" + active + ", maxRetries=" + maxRetries + '}';
  }

  public static final class Builder {
    private String id;
    private String organizationId;
    private String name;
    private String description;
    private String url;
    private String secret;
    private Set<String> events = Set.of();
    private FilterCriteria filters;
    private Map<String, String> customHeaders = Map.of();
    private boolean active = true;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private Instant lastTriggeredAt;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private long successCount;
    private long failureCount;
    private Instant createdAt;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder organizationId(String organizationId) {
      this.organizationId = organizationId;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder secret(String secret) {
      this.secret = secret;
      return this;
    }

    public Builder events(Set<String> events) {
      this.events = Objects.requireNonNull(events, "events");
      return this;
    }

    public Builder events(String... events) {
      return events(new LinkedHashSet<>(Arrays.asList(events)));
    }

    public Builder filters(FilterCriteria filters) {
      this.filters = filters;
      return this;
    }

    public Builder customHeaders(Map<String, String> customHeaders) {
      this.customHeaders = customHeaders == null ? Map.of() : customHeaders;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder lastTriggeredAt(Instant lastTriggeredAt) {
      this.lastTriggeredAt = lastTriggeredAt;
      return this;
    }

    public Builder lastSuccessAt(Instant lastSuccessAt) {
      this.lastSuccessAt = lastSuccessAt;
      return this;
    }

    public Builder lastFailureAt(Instant lastFailureAt) {
      this.lastFailureAt = lastFailureAt;
      return this;
    }

    public Builder successCount(long successCount) {
      this.successCount = successCount;
      return this;
    }

    public Builder failureCount(long failureCount) {
      this.failureCount = failureCount;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Subscription build() {
      return new Subscription(this);
    }
  }
}
