package io.incentedge.webhooks.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectEventData(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("previous_status") String previousStatus,
    @JsonProperty("current_status") String currentStatus,
    @JsonProperty("changes") Map<String, FieldChange> changes
) implements EventPayload {
  public ProjectEventData {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(projectName, "projectName");
    changes = changes == null ? null : Map.copyOf(changes);
  }

  public static ProjectEventData of(String projectId, String projectName) {
    return new ProjectEventData(projectId, projectName, null, null, null);
  }
}
