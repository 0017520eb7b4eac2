package io.incentedge.webhooks.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * @param deadline      due date, serialized as {@code yyyy-MM-dd}
 * @param daysRemaining whole days until the deadline, negative once passed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadlineEventData(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("application_id") String applicationId,
    @JsonProperty("incentive_program_id") String incentiveProgramId,
    @JsonProperty("program_name") String programName,
    @JsonProperty("deadline") LocalDate deadline,
    @JsonProperty("days_remaining") int daysRemaining
) implements EventPayload {
  public DeadlineEventData {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(incentiveProgramId, "incentiveProgramId");
    Objects.requireNonNull(deadline, "deadline");
  }
}
