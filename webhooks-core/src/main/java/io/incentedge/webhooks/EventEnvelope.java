package io.incentedge.webhooks;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event envelope sent to every subscriber of one event.
 *
 * <p>The envelope is serialized once when the event is dispatched and the resulting bytes
 * are stored with each delivery record, so every recipient and every retry sees the same
 * body. {@code data} is deep-copied into unmodifiable maps and lists on construction; later
 * changes to the caller's objects do not reach the envelope.
 *
 * <p>Wire form:
 * <pre>{@code
 * {"id":"evt_01J...","event":"application.submitted","created_at":"2026-01-01T00:00:00.000Z",
 *  "organization_id":"org_1","api_version":"2026-01-01","data":{...},"metadata":{...}}
 * }</pre>
 *
 * @see EnvelopeFormatter
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "event", "created_at", "organization_id", "api_version", "data", "metadata"})
public final class EventEnvelope {
  public static final String DEFAULT_API_VERSION = "2026-01-01";

  private final String id;
  private final String event;
  private final Instant createdAt;
  private final String organizationId;
  private final String apiVersion;
  private final Map<String, Object> data;
  private final EventMetadata metadata;

  private EventEnvelope(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.event = Objects.requireNonNull(builder.event, "event");
    if (event.isEmpty()) {
      throw new IllegalArgumentException("event cannot be empty");
    }
    this.createdAt = builder.createdAt == null
        ? Instant.now().truncatedTo(ChronoUnit.MILLIS) : builder.createdAt;
    this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId");
    this.apiVersion = builder.apiVersion == null ? DEFAULT_API_VERSION : builder.apiVersion;
    this.data = builder.data == null ? Collections.emptyMap() : copyMap(builder.data);
    this.metadata = builder.metadata;
  }

  @JsonCreator
  static EventEnvelope fromJson(
      @JsonProperty("id") String id,
      @JsonProperty("event") String event,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("organization_id") String organizationId,
      @JsonProperty("api_version") String apiVersion,
      @JsonProperty("data") Map<String, Object> data,
      @JsonProperty("metadata") EventMetadata metadata) {
    return builder()
        .id(id)
        .event(event)
        .createdAt(createdAt)
        .organizationId(organizationId)
        .apiVersion(apiVersion)
        .data(data)
        .metadata(metadata)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @JsonProperty("id")
  public String id() {
    return id;
  }

  @JsonProperty("event")
  public String event() {
    return event;
  }

  @JsonProperty("created_at")
  public Instant createdAt() {
    return createdAt;
  }

  @JsonProperty("organization_id")
  public String organizationId() {
    return organizationId;
  }

  @JsonProperty("api_version")
  public String apiVersion() {
    return apiVersion;
  }

  @JsonProperty("data")
  public Map<String, Object> data() {
    return data;
  }

  @JsonProperty("metadata")
  public EventMetadata metadata() {
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventEnvelope other)) return false;
    return id.equals(other.id)
        && event.equals(other.event)
        && createdAt.equals(other.createdAt)
        && organizationId.equals(other.organizationId)
        && apiVersion.equals(other.apiVersion)
        && data.equals(other.data)
        && Objects.equals(metadata, other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, event, createdAt, organizationId, apiVersion, data, metadata);
  }

  @Override
  public String toString() {
    return "EventEnvelope{id=" + id + ", event=" + event + ", organizationId=" + organizationId
        + ", createdAt=" + createdAt + '}';
  }

  private static Map<String, Object> copyMap(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("data cannot contain null keys");
      }
      copy.put(entry.getKey().toString(), copyValue(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return copyMap(map);
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object element : collection) {
        copy.add(copyValue(element));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  /** Builder for {@link EventEnvelope}. */
  public static final class Builder {
    private String id;
    private String event;
    private Instant createdAt;
    private String organizationId;
    private String apiVersion;
    private Map<String, ?> data;
    private EventMetadata metadata;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder event(String event) {
      this.event = event;
      return this;
    }

    public Builder event(WebhookEventType eventType) {
      this.event = Objects.requireNonNull(eventType, "eventType").wireName();
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder organizationId(String organizationId) {
      this.organizationId = organizationId;
      return this;
    }

    public Builder apiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    /**
     * Sets the event data. Nested maps and collections are copied on {@link #build()};
     * leaf values should be immutable (strings, numbers, booleans).
     */
    public Builder data(Map<String, ?> data) {
      this.data = data;
      return this;
    }

    public Builder metadata(EventMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    public EventEnvelope build() {
      return new EventEnvelope(this);
    }
  }
}
