package io.incentedge.webhooks.filter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-subscription narrowing rules. Every populated dimension must match for an event to
 * be delivered; an empty list or absent bound places no constraint.
 *
 * <p>Stored as a JSON object with snake_case keys. Unknown keys are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FilterCriteria(
    @JsonProperty("project_ids") List<String> projectIds,
    @JsonProperty("application_ids") List<String> applicationIds,
    @JsonProperty("incentive_program_ids") List<String> incentiveProgramIds,
    @JsonProperty("statuses") List<String> statuses,
    @JsonProperty("sectors") List<String> sectors,
    @JsonProperty("states") List<String> states,
    @JsonProperty("min_value") BigDecimal minValue,
    @JsonProperty("max_value") BigDecimal maxValue) {

  public static final FilterCriteria EMPTY =
      new FilterCriteria(null, null, null, null, null, null, null, null);

  public FilterCriteria {
    projectIds = copy(projectIds);
    applicationIds = copy(applicationIds);
    incentiveProgramIds = copy(incentiveProgramIds);
    statuses = copy(statuses);
    sectors = copy(sectors);
    states = copy(states);
    if (minValue != null && maxValue != null && minValue.compareTo(maxValue) > 0) {
      throw new IllegalArgumentException("min_value " + minValue + " exceeds max_value " + maxValue);
    }
  }

  /** Whether no dimension is populated. */
  @JsonIgnore
  public boolean isEmpty() {
    return projectIds.isEmpty() && applicationIds.isEmpty() && incentiveProgramIds.isEmpty()
        && statuses.isEmpty() && sectors.isEmpty() && states.isEmpty()
        && minValue == null && maxValue == null;
  }

  public static Builder builder() {
    return new Builder();
  }

  private static List<String> copy(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    List<String> copy = new ArrayList<>(values.size());
    for (String value : values) {
      if (value != null) {
        copy.add(value);
      }
    }
    return List.copyOf(copy);
  }

  public static final class Builder {
    private List<String> projectIds;
    private List<String> applicationIds;
    private List<String> incentiveProgramIds;
    private List<String> statuses;
    private List<String> sectors;
    private List<String> states;
    private BigDecimal minValue;
    private BigDecimal maxValue;

    private Builder() {}

    public Builder projectIds(String... ids) {
      this.projectIds = List.of(ids);
      return this;
    }

    public Builder applicationIds(String... ids) {
      this.applicationIds = List.of(ids);
      return this;
    }

    public Builder incentiveProgramIds(String... ids) {
      this.incentiveProgramIds = List.of(ids);
      return this;
    }

    public Builder statuses(String... statuses) {
      this.statuses = List.of(statuses);
      return this;
    }

    public Builder sectors(String... sectors) {
      this.sectors = List.of(sectors);
      return this;
    }

    public Builder states(String... states) {
      this.states = List.of(states);
      return this;
    }

    public Builder minValue(BigDecimal minValue) {
      this.minValue = minValue;
      return this;
    }

    public Builder minValue(long minValue) {
      return minValue(BigDecimal.valueOf(minValue));
    }

    public Builder maxValue(BigDecimal maxValue) {
      this.maxValue = maxValue;
      return this;
    }

    public Builder maxValue(long maxValue) {
      return maxValue(BigDecimal.valueOf(maxValue));
    }

    public FilterCriteria build() {
      return new FilterCriteria(projectIds, applicationIds, incentiveProgramIds, statuses,
          sectors, states, minValue, maxValue);
    }
  }
}
