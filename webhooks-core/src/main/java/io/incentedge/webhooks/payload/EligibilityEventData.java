package io.incentedge.webhooks.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EligibilityEventData(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("matches_count") int matchesCount,
    @JsonProperty("total_potential_value") BigDecimal totalPotentialValue,
    @JsonProperty("new_matches") List<Match> newMatches
) implements EventPayload {
  public EligibilityEventData {
    Objects.requireNonNull(projectId, "projectId");
    newMatches = newMatches == null ? null : List.copyOf(newMatches);
  }

  /** One newly matched incentive program. */
  public record Match(
      @JsonProperty("incentive_program_id") String incentiveProgramId,
      @JsonProperty("program_name") String programName,
      @JsonProperty("estimated_value") BigDecimal estimatedValue,
      @JsonProperty("match_score") double matchScore) {}
}
