package io.incentedge.webhooks.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplicationEventData(
    @JsonProperty("application_id") String applicationId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("incentive_program_id") String incentiveProgramId,
    @JsonProperty("program_name") String programName,
    @JsonProperty("previous_status") String previousStatus,
    @JsonProperty("current_status") String currentStatus,
    @JsonProperty("amount_requested") BigDecimal amountRequested,
    @JsonProperty("amount_approved") BigDecimal amountApproved
) implements EventPayload {
  public ApplicationEventData {
    Objects.requireNonNull(applicationId, "applicationId");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(incentiveProgramId, "incentiveProgramId");
  }
}
