package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.model.DeliveryOutcome;

import java.util.List;

/**
 * Summary of one {@link WebhookDispatcher#dispatch} call.
 *
 * @param eventId        envelope id shared by every record of the event
 * @param recordsCreated delivery records created
 * @param errors         per-subscription failures, empty when all succeeded
 * @param outcomes       attempt outcomes for immediate dispatch, empty otherwise
 */
public record DispatchResult(String eventId, int recordsCreated, List<DispatchError> errors,
                             List<DeliveryOutcome> outcomes) {
  public DispatchResult {
    errors = List.copyOf(errors);
    outcomes = List.copyOf(outcomes);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
