package io.incentedge.webhooks.jdbc.store;

import io.incentedge.webhooks.jdbc.JdbcTemplate;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL delivery store. Also compatible with TiDB.
 *
 * <p>MySQL rejects a subquery on the table being updated, so the claim is an
 * {@code UPDATE...ORDER BY...LIMIT} that stamps a claim token, followed by a {@code SELECT}
 * of the rows carrying that token. The due predicate is part of the {@code UPDATE}, so
 * concurrent claimers never win the same row.
 */
public final class MySqlDeliveryStore extends AbstractJdbcDeliveryStore {

  public MySqlDeliveryStore() {
    super();
  }

  public MySqlDeliveryStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  protected AbstractJdbcDeliveryStore newInstance(String tableName, JsonCodec jsonCodec) {
    return new MySqlDeliveryStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = millis(now);
    String token = newClaimToken();
    String claimSql = "UPDATE " + tableName() + " SET status=" + SENDING + ", locked_at=?, locked_by=? "
        + "WHERE " + DUE_CONDITION + " ORDER BY " + DUE_ORDER + " LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql,
        nowMs, token, now, now, lockExpiry, limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, token);
  }
}
