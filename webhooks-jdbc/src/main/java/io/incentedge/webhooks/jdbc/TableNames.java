package io.incentedge.webhooks.jdbc;

import java.util.Objects;

/**
 * Default table names and shared table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String DEFAULT_SUBSCRIPTION_TABLE = "webhook_subscription";
  public static final String DEFAULT_SUBSCRIPTION_EVENT_TABLE = "webhook_subscription_event";
  public static final String DEFAULT_DELIVERY_TABLE = "webhook_delivery";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns the name unchanged if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException if the name contains anything but letters, digits and
   *     underscores, or starts with a digit
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
