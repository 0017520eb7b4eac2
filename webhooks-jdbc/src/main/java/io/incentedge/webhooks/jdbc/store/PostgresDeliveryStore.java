package io.incentedge.webhooks.jdbc.store;

import io.incentedge.webhooks.jdbc.JdbcTemplate;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL delivery store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip
 * claim; rows locked by a concurrent claimer are skipped rather than waited on.
 */
public final class PostgresDeliveryStore extends AbstractJdbcDeliveryStore {
  private static final Comparator<DeliveryRecord> DUE_FIRST = Comparator
      .comparing((DeliveryRecord r) -> r.nextRetryAt() != null ? r.nextRetryAt() : r.scheduledAt())
      .thenComparing(DeliveryRecord::id);

  public PostgresDeliveryStore() {
    super();
  }

  public PostgresDeliveryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  protected AbstractJdbcDeliveryStore newInstance(String tableName, JsonCodec jsonCodec) {
    return new PostgresDeliveryStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = millis(now);
    String sql = "UPDATE " + tableName() + " SET status=" + SENDING + ", locked_at=?, locked_by=? "
        + "WHERE id IN (SELECT id FROM " + tableName() + " WHERE " + DUE_CONDITION
        + " ORDER BY " + DUE_ORDER + " LIMIT ? FOR UPDATE SKIP LOCKED) "
        + "RETURNING " + COLUMNS;
    List<DeliveryRecord> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, this::mapRecord,
        nowMs, newClaimToken(), now, now, lockExpiry, limit));
    // RETURNING does not preserve the subquery order
    claimed.sort(DUE_FIRST);
    return claimed;
  }
}
