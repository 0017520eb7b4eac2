package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.WebhookEventType;
import io.incentedge.webhooks.payload.ApplicationEventData;
import io.incentedge.webhooks.payload.DeadlineEventData;
import io.incentedge.webhooks.payload.EligibilityEventData;
import io.incentedge.webhooks.payload.ProjectEventData;

import java.util.Objects;

/**
 * Typed entry points for the common events. Each method copies the correlation ids carried
 * by the data into the dispatch options, keeping any other option the caller set.
 */
public final class WebhookEvents {
  private final WebhookDispatcher dispatcher;

  public WebhookEvents(WebhookDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  public DispatchResult projectCreated(String organizationId, ProjectEventData data, DispatchOptions options) {
    DispatchOptions opts = base(options).projectId(data.projectId()).build();
    return dispatcher.dispatch(WebhookEventType.PROJECT_CREATED, data, organizationId, opts);
  }

  public DispatchResult applicationSubmitted(String organizationId, ApplicationEventData data,
      DispatchOptions options) {
    DispatchOptions opts = base(options)
        .projectId(data.projectId())
        .applicationId(data.applicationId())
        .incentiveProgramId(data.incentiveProgramId())
        .build();
    return dispatcher.dispatch(WebhookEventType.APPLICATION_SUBMITTED, data, organizationId, opts);
  }

  public DispatchResult deadlineApproaching(String organizationId, DeadlineEventData data,
      DispatchOptions options) {
    DispatchOptions opts = base(options)
        .projectId(data.projectId())
        .applicationId(data.applicationId())
        .incentiveProgramId(data.incentiveProgramId())
        .build();
    return dispatcher.dispatch(WebhookEventType.DEADLINE_APPROACHING, data, organizationId, opts);
  }

  public DispatchResult eligibilityScanCompleted(String organizationId, EligibilityEventData data,
      DispatchOptions options) {
    DispatchOptions opts = base(options).projectId(data.projectId()).build();
    return dispatcher.dispatch(WebhookEventType.ELIGIBILITY_SCAN_COMPLETED, data, organizationId, opts);
  }

  private static DispatchOptions.Builder base(DispatchOptions options) {
    return options != null ? options.toBuilder() : DispatchOptions.builder();
  }
}
