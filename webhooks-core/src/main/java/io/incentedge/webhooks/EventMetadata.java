package io.incentedge.webhooks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional context about who or what produced an event.
 *
 * @param userId      acting user id
 * @param userEmail   acting user email
 * @param ipAddress   source IP of the triggering request
 * @param triggeredBy {@code immediate} or {@code queue}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventMetadata(
    @JsonProperty("user_id") String userId,
    @JsonProperty("user_email") String userEmail,
    @JsonProperty("ip_address") String ipAddress,
    @JsonProperty("triggered_by") String triggeredBy
) {
  public static final String TRIGGERED_IMMEDIATE = "immediate";
  public static final String TRIGGERED_QUEUE = "queue";
}
