package io.incentedge.webhooks;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of event types a subscription may listen to.
 *
 * <p>Each constant carries its wire name (e.g. {@code project.created}), which is what
 * appears in the envelope's {@code event} field, in the {@code X-IncentEdge-Event}
 * header, and in a subscription's event set.
 */
public enum WebhookEventType {
  PROJECT_CREATED("project.created"),
  PROJECT_UPDATED("project.updated"),
  PROJECT_DELETED("project.deleted"),
  PROJECT_STATUS_CHANGED("project.status_changed"),
  PROJECT_ARCHIVED("project.archived"),

  ELIGIBILITY_SCAN_COMPLETED("eligibility.scan_completed"),
  ELIGIBILITY_NEW_MATCH("eligibility.new_match"),
  ELIGIBILITY_MATCH_UPDATED("eligibility.match_updated"),
  ELIGIBILITY_MATCH_EXPIRED("eligibility.match_expired"),

  APPLICATION_CREATED("application.created"),
  APPLICATION_SUBMITTED("application.submitted"),
  APPLICATION_STATUS_CHANGED("application.status_changed"),
  APPLICATION_APPROVED("application.approved"),
  APPLICATION_REJECTED("application.rejected"),
  APPLICATION_DOCUMENT_ADDED("application.document_added"),

  DEADLINE_APPROACHING("deadline.approaching"),
  DEADLINE_TODAY("deadline.today"),
  DEADLINE_PASSED("deadline.passed"),

  PROGRAM_NEW_AVAILABLE("program.new_available"),
  PROGRAM_UPDATED("program.updated"),
  PROGRAM_EXPIRING("program.expiring"),
  PROGRAM_EXPIRED("program.expired"),

  DOCUMENT_UPLOADED("document.uploaded"),
  DOCUMENT_PROCESSED("document.processed"),
  DOCUMENT_AI_EXTRACTED("document.ai_extracted"),

  COST_ESTIMATE_GENERATED("cost_estimate.generated"),
  COST_ESTIMATE_UPDATED("cost_estimate.updated"),

  INTEGRATION_CONNECTED("integration.connected"),
  INTEGRATION_DISCONNECTED("integration.disconnected"),
  INTEGRATION_SYNC_COMPLETED("integration.sync_completed"),
  INTEGRATION_SYNC_FAILED("integration.sync_failed"),

  WEBHOOK_TEST("webhook.test");

  private static final Map<String, WebhookEventType> BY_WIRE_NAME = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(WebhookEventType::wireName, Function.identity()));

  private final String wireName;

  WebhookEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Looks up an event type by its wire name.
   *
   * @param wireName the dotted name, e.g. {@code application.submitted}
   * @return the matching event type
   * @throws IllegalArgumentException if the name is not a known event type
   */
  public static WebhookEventType fromWireName(String wireName) {
    Objects.requireNonNull(wireName, "wireName");
    WebhookEventType type = BY_WIRE_NAME.get(wireName);
    if (type == null) {
      throw new IllegalArgumentException("Unknown webhook event type: " + wireName);
    }
    return type;
  }

  public static boolean isKnown(String wireName) {
    return wireName != null && BY_WIRE_NAME.containsKey(wireName);
  }

  @Override
  public String toString() {
    return wireName;
  }
}
