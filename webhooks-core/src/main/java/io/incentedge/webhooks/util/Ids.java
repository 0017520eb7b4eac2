package io.incentedge.webhooks.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation. Ids are monotonic ULIDs: time-ordered with a random suffix.
 */
public final class Ids {
  public static final String EVENT_PREFIX = "evt_";

  private Ids() {}

  /** New envelope id, {@code evt_} followed by a lower-case ULID. */
  public static String newEventId() {
    return EVENT_PREFIX + UlidCreator.getMonotonicUlid().toLowerCase();
  }

  /** New delivery record or subscription id. */
  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
