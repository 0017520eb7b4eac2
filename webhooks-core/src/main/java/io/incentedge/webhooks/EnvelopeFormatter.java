package io.incentedge.webhooks;

import io.incentedge.webhooks.util.Ids;
import io.incentedge.webhooks.util.JsonCodec;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Builds and serializes {@link EventEnvelope}s.
 *
 * <p>Every call to {@link #format} generates a new envelope id. Event data may be a map, a
 * record or any Jackson-serializable bean; it is converted into plain maps, lists and
 * scalars before being copied into the envelope.
 */
public final class EnvelopeFormatter {
  private final JsonCodec jsonCodec;
  private final String apiVersion;
  private final Clock clock;

  public EnvelopeFormatter() {
    this(JsonCodec.getDefault(), EventEnvelope.DEFAULT_API_VERSION, Clock.systemUTC());
  }

  public EnvelopeFormatter(JsonCodec jsonCodec, String apiVersion, Clock clock) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a new envelope.
   *
   * @param eventType      event-type wire name
   * @param data           event data, {@code null} for an empty object
   * @param organizationId owning organization
   * @param metadata       optional actor metadata
   * @return a fresh envelope with a new id and the current time
   * @throws IllegalArgumentException if {@code data} does not convert to a JSON object
   */
  public EventEnvelope format(String eventType, Object data, String organizationId,
      EventMetadata metadata) {
    return EventEnvelope.builder()
        .id(Ids.newEventId())
        .event(eventType)
        .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
        .organizationId(organizationId)
        .apiVersion(apiVersion)
        .data(jsonCodec.toMap(data))
        .metadata(metadata)
        .build();
  }

  /**
   * Serializes an envelope to the JSON text stored and sent for every delivery of it.
   */
  public String serialize(EventEnvelope envelope) {
    return jsonCodec.toJson(Objects.requireNonNull(envelope, "envelope"));
  }

  public JsonCodec jsonCodec() {
    return jsonCodec;
  }

  public String apiVersion() {
    return apiVersion;
  }
}
