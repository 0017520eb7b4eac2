package io.incentedge.webhooks.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of delivering one event to one subscription.
 *
 * <p>Instances are immutable snapshots of a row; stores return fresh instances after every
 * transition. Use {@link #toBuilder()} to derive a modified copy.
 */
public final class DeliveryRecord {
  /** Maximum characters of response body kept per attempt. */
  public static final int MAX_RESPONSE_BODY_CHARS = 10_000;
  /** Maximum characters of error message kept per attempt. */
  public static final int MAX_ERROR_MESSAGE_CHARS = 4_000;

  private final String id;
  private final String subscriptionId;
  private final String organizationId;
  private final String eventId;
  private final String eventType;
  private final String projectId;
  private final String applicationId;
  private final String incentiveProgramId;
  private final String payloadJson;
  private final String payloadHash;
  private final DeliveryStatus status;
  private final int attemptCount;
  private final int maxAttempts;
  private final Instant scheduledAt;
  private final Instant nextRetryAt;
  private final String requestUrl;
  private final Integer responseStatusCode;
  private final Map<String, String> responseHeaders;
  private final String responseBody;
  private final Long responseTimeMs;
  private final String errorMessage;
  private final Instant sentAt;
  private final Instant deliveredAt;
  private final Instant failedAt;
  private final Instant lockedAt;
  private final String replayOf;
  private final Instant createdAt;

  private DeliveryRecord(Builder builder) {
    this.id = Objects.requireNonNull(builder.id, "id");
    this.subscriptionId = Objects.requireNonNull(builder.subscriptionId, "subscriptionId");
    this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId");
    this.eventId = Objects.requireNonNull(builder.eventId, "eventId");
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    this.projectId = builder.projectId;
    this.applicationId = builder.applicationId;
    this.incentiveProgramId = builder.incentiveProgramId;
    this.payloadJson = Objects.requireNonNull(builder.payloadJson, "payloadJson");
    this.payloadHash = builder.payloadHash == null ? sha256Hex(payloadJson) : builder.payloadHash;
    this.status = Objects.requireNonNull(builder.status, "status");
    if (builder.attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0, got: " + builder.attemptCount);
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.attemptCount = builder.attemptCount;
    this.maxAttempts = builder.maxAttempts;
    this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    this.scheduledAt = builder.scheduledAt == null ? createdAt : builder.scheduledAt;
    this.nextRetryAt = builder.nextRetryAt;
    this.requestUrl = Objects.requireNonNull(builder.requestUrl, "requestUrl");
    this.responseStatusCode = builder.responseStatusCode;
    this.responseHeaders = builder.responseHeaders == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.responseHeaders));
    this.responseBody = truncate(builder.responseBody, MAX_RESPONSE_BODY_CHARS);
    this.responseTimeMs = builder.responseTimeMs;
    this.errorMessage = truncate(builder.errorMessage, MAX_ERROR_MESSAGE_CHARS);
    this.sentAt = builder.sentAt;
    this.deliveredAt = builder.deliveredAt;
    this.failedAt = builder.failedAt;
    this.lockedAt = builder.lockedAt;
    this.replayOf = builder.replayOf;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .subscriptionId(subscriptionId)
        .organizationId(organizationId)
        .eventId(eventId)
        .eventType(eventType)
        .projectId(projectId)
        .applicationId(applicationId)
        .incentiveProgramId(incentiveProgramId)
        .payloadJson(payloadJson)
        .status(status)
        .attemptCount(attemptCount)
        .maxAttempts(maxAttempts)
        .scheduledAt(scheduledAt)
        .nextRetryAt(nextRetryAt)
        .requestUrl(requestUrl)
        .responseStatusCode(responseStatusCode)
        .responseHeaders(responseHeaders)
        .responseBody(responseBody)
        .responseTimeMs(responseTimeMs)
        .errorMessage(errorMessage)
        .sentAt(sentAt)
        .deliveredAt(deliveredAt)
        .failedAt(failedAt)
        .lockedAt(lockedAt)
        .replayOf(replayOf)
        .createdAt(createdAt);
  }

  public String id() {
    return id;
  }

  public String subscriptionId() {
    return subscriptionId;
  }

  public String organizationId() {
    return organizationId;
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  public String projectId() {
    return projectId;
  }

  public String applicationId() {
    return applicationId;
  }

  public String incentiveProgramId() {
    return incentiveProgramId;
  }

  /** The serialized envelope, sent verbatim on every attempt. */
  public String payloadJson() {
    return payloadJson;
  }

  /** Lower-case hex SHA-256 of the UTF-8 payload bytes. */
  public String payloadHash() {
    return payloadHash;
  }

  public DeliveryStatus status() {
    return status;
  }

  /** Attempts made so far; incremented once per completed attempt. */
  public int attemptCount() {
    return attemptCount;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Instant scheduledAt() {
    return scheduledAt;
  }

  public Instant nextRetryAt() {
    return nextRetryAt;
  }

  /** Subscriber URL at the time the record was created. */
  public String requestUrl() {
    return requestUrl;
  }

  public Integer responseStatusCode() {
    return responseStatusCode;
  }

  public Map<String, String> responseHeaders() {
    return responseHeaders;
  }

  public String responseBody() {
    return responseBody;
  }

  public Long responseTimeMs() {
    return responseTimeMs;
  }

  public String errorMessage() {
    return errorMessage;
  }

  public Instant sentAt() {
    return sentAt;
  }

  public Instant deliveredAt() {
    return deliveredAt;
  }

  public Instant failedAt() {
    return failedAt;
  }

  /** Start of the current lease while {@code sending}. */
  public Instant lockedAt() {
    return lockedAt;
  }

  /** Id of the exhausted record this one replays, if any. */
  public String replayOf() {
    return replayOf;
  }

  public Instant createdAt() {
    return createdAt;
  }

  /** Whether another attempt is allowed after the current one fails. */
  public boolean hasAttemptsRemaining() {
    return attemptCount + 1 < maxAttempts;
  }

  /**
   * Hex SHA-256 of a payload's UTF-8 bytes.
   *
   * @param payload the serialized envelope
   * @return 64 lower-case hex characters
   */
  public static String sha256Hex(String payload) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  static String truncate(String value, int maxChars) {
    if (value == null || value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DeliveryRecord other)) return false;
    return id.equals(other.id) && status == other.status && attemptCount == other.attemptCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, status, attemptCount);
  }

  @Override
  public String toString() {
    return "DeliveryRecord{id=" + id + ", subscriptionId=" + subscriptionId + ", eventId=" + eventId
        + ", eventType=" + eventType + ", status=" + status + ", attemptCount=" + attemptCount
        + "/" + maxAttempts + ", nextRetryAt=" + nextRetryAt + '}';
  }

  public static final class Builder {
    private String id;
    private String subscriptionId;
    private String organizationId;
    private String eventId;
    private String eventType;
    private String projectId;
    private String applicationId;
    private String incentiveProgramId;
    private String payloadJson;
    private String payloadHash;
    private DeliveryStatus status;
    private int attemptCount;
    private int maxAttempts = Subscription.DEFAULT_MAX_RETRIES + 1;
    private Instant scheduledAt;
    private Instant nextRetryAt;
    private String requestUrl;
    private Integer responseStatusCode;
    private Map<String, String> responseHeaders;
    private String responseBody;
    private Long responseTimeMs;
    private String errorMessage;
    private Instant sentAt;
    private Instant deliveredAt;
    private Instant failedAt;
    private Instant lockedAt;
    private String replayOf;
    private Instant createdAt;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder subscriptionId(String subscriptionId) {
      this.subscriptionId = subscriptionId;
      return this;
    }

    public Builder organizationId(String organizationId) {
      this.organizationId = organizationId;
      return this;
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder eventType(String eventType) {
      this.eventType = eventType;
      return this;
    }

    public Builder projectId(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder applicationId(String applicationId) {
      this.applicationId = applicationId;
      return this;
    }

    public Builder incentiveProgramId(String incentiveProgramId) {
      this.incentiveProgramId = incentiveProgramId;
      return this;
    }

    public Builder payloadJson(String payloadJson) {
      this.payloadJson = payloadJson;
      return this;
    }

    public Builder payloadHash(String payloadHash) {
      this.payloadHash = payloadHash;
      return this;
    }

    public Builder status(DeliveryStatus status) {
      this.status = status;
      return this;
    }

    public Builder attemptCount(int attemptCount) {
      this.attemptCount = attemptCount;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder scheduledAt(Instant scheduledAt) {
      this.scheduledAt = scheduledAt;
      return this;
    }

    public Builder nextRetryAt(Instant nextRetryAt) {
      this.nextRetryAt = nextRetryAt;
      return this;
    }

    public Builder requestUrl(String requestUrl) {
      this.requestUrl = requestUrl;
      return this;
    }

    public Builder responseStatusCode(Integer responseStatusCode) {
      this.responseStatusCode = responseStatusCode;
      return this;
    }

    public Builder responseHeaders(Map<String, String> responseHeaders) {
      this.responseHeaders = responseHeaders;
      return this;
    }

    public Builder responseBody(String responseBody) {
      this.responseBody = responseBody;
      return this;
    }

    public Builder responseTimeMs(Long responseTimeMs) {
      this.responseTimeMs = responseTimeMs;
      return this;
    }

    public Builder errorMessage(String errorMessage) {
      this.errorMessage = errorMessage;
      return this;
    }

    public Builder sentAt(Instant sentAt) {
      this.sentAt = sentAt;
      return this;
    }

    public Builder deliveredAt(Instant deliveredAt) {
      this.deliveredAt = deliveredAt;
      return this;
    }

    public Builder failedAt(Instant failedAt) {
      this.failedAt = failedAt;
      return this;
    }

    public Builder lockedAt(Instant lockedAt) {
      this.lockedAt = lockedAt;
      return this;
    }

    public Builder replayOf(String replayOf) {
      this.replayOf = replayOf;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public DeliveryRecord build() {
      return new DeliveryRecord(this);
    }
  }
}
