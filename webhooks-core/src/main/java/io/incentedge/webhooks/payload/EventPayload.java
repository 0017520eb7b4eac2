package io.incentedge.webhooks.payload;

/**
 * Typed event data for the events with a fixed schema. Serialized with snake_case keys.
 */
public sealed interface EventPayload
    permits ProjectEventData, ApplicationEventData, DeadlineEventData, EligibilityEventData {

  String projectId();
}
