package io.incentedge.webhooks.jdbc.store;

import io.incentedge.webhooks.util.JsonCodec;

import java.util.List;

/**
 * H2 delivery store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcDeliveryStore}.
 */
public final class H2DeliveryStore extends AbstractJdbcDeliveryStore {

  public H2DeliveryStore() {
    super();
  }

  public H2DeliveryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  protected AbstractJdbcDeliveryStore newInstance(String tableName, JsonCodec jsonCodec) {
    return new H2DeliveryStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
