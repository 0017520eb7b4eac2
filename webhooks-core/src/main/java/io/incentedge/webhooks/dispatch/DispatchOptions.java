package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.EventMetadata;

/**
 * Per-call options for {@link WebhookDispatcher#dispatch}.
 *
 * <p>The correlation ids are stored on each delivery record for querying; they do not
 * affect routing. {@code immediate} sends the event before {@code dispatch} returns instead
 * of leaving the records for the retry scheduler.
 */
public final class DispatchOptions {
  public static final DispatchOptions DEFAULT = builder().build();

  private final String projectId;
  private final String applicationId;
  private final String incentiveProgramId;
  private final String userId;
  private final String userEmail;
  private final String ipAddress;
  private final boolean immediate;

  private DispatchOptions(Builder builder) {
    this.projectId = builder.projectId;
    this.applicationId = builder.applicationId;
    this.incentiveProgramId = builder.incentiveProgramId;
    this.userId = builder.userId;
    this.userEmail = builder.userEmail;
    this.ipAddress = builder.ipAddress;
    this.immediate = builder.immediate;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .projectId(projectId)
        .applicationId(applicationId)
        .incentiveProgramId(incentiveProgramId)
        .userId(userId)
        .userEmail(userEmail)
        .ipAddress(ipAddress)
        .immediate(immediate);
  }

  public String projectId() {
    return projectId;
  }

  public String applicationId() {
    return applicationId;
  }

  public String incentiveProgramId() {
    return incentiveProgramId;
  }

  public String userId() {
    return userId;
  }

  public String userEmail() {
    return userEmail;
  }

  public String ipAddress() {
    return ipAddress;
  }

  public boolean immediate() {
    return immediate;
  }

  EventMetadata toMetadata() {
    return new EventMetadata(userId, userEmail, ipAddress,
        immediate ? EventMetadata.TRIGGERED_IMMEDIATE : EventMetadata.TRIGGERED_QUEUE);
  }

  public static final class Builder {
    private String projectId;
    private String applicationId;
    private String incentiveProgramId;
    private String userId;
    private String userEmail;
    private String ipAddress;
    private boolean immediate;

    private Builder() {}

    public Builder projectId(String projectId) {
      this.projectId = projectId;
      return this;
    }

    public Builder applicationId(String applicationId) {
      this.applicationId = applicationId;
      return this;
    }

    public Builder incentiveProgramId(String incentiveProgramId) {
      this.incentiveProgramId = incentiveProgramId;
      return this;
    }

    /** Acting user, copied into the envelope metadata. */
    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder userEmail(String userEmail) {
      this.userEmail = userEmail;
      return this;
    }

    public Builder ipAddress(String ipAddress) {
      this.ipAddress = ipAddress;
      return this;
    }

    public Builder immediate(boolean immediate) {
      this.immediate = immediate;
      return this;
    }

    public DispatchOptions build() {
      return new DispatchOptions(this);
    }
  }
}
