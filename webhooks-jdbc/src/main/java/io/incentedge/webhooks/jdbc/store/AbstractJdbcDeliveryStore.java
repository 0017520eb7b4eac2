package io.incentedge.webhooks.jdbc.store;

import io.incentedge.webhooks.jdbc.JdbcTemplate;
import io.incentedge.webhooks.jdbc.TableNames;
import io.incentedge.webhooks.model.DeliveryAttempt;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStats;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Base JDBC delivery store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim strategies.
 * Every claim stamps the rows it wins with a fresh {@code locked_by} token, so the rows
 * returned are exactly the ones this call moved to {@code sending}. Register custom
 * implementations via
 * {@code META-INF/services/io.incentedge.webhooks.jdbc.store.AbstractJdbcDeliveryStore}.
 *
 * @see JdbcDeliveryStores
 */
public abstract class AbstractJdbcDeliveryStore implements DeliveryStore {

  protected static final String COLUMNS = "id, subscription_id, organization_id, event_id, event_type, "
      + "project_id, application_id, incentive_program_id, payload, payload_hash, status, "
      + "attempt_count, max_attempts, scheduled_at, next_retry_at, request_url, "
      + "response_status_code, response_headers, response_body, response_time_ms, error_message, "
      + "sent_at, delivered_at, failed_at, locked_at, replay_of, created_at";

  protected static final String SENDING = quoted(DeliveryStatus.SENDING);

  /** Rows that may be claimed; binds {@code now}, {@code now}, {@code lockExpiry}. */
  protected static final String DUE_CONDITION =
      "((status=" + quoted(DeliveryStatus.PENDING) + " AND scheduled_at <= ?)"
          + " OR (status=" + quoted(DeliveryStatus.RETRYING) + " AND next_retry_at <= ?)"
          + " OR (status=" + SENDING + " AND locked_at < ?))";

  protected static final String DUE_ORDER = "COALESCE(next_retry_at, scheduled_at), id";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcDeliveryStore() {
    this(TableNames.DEFAULT_DELIVERY_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcDeliveryStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this delivery store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this delivery store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Creates a store of the same kind with the given table and codec.
   */
  protected abstract AbstractJdbcDeliveryStore newInstance(String tableName, JsonCodec jsonCodec);

  /** Returns a copy of this store that reads and writes the given table. */
  public AbstractJdbcDeliveryStore withTableName(String tableName) {
    return newInstance(tableName, jsonCodec);
  }

  /** Returns a copy of this store that encodes response headers with the given codec. */
  public AbstractJdbcDeliveryStore withJsonCodec(JsonCodec jsonCodec) {
    return newInstance(tableName, jsonCodec);
  }

  public String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public void insertNew(Connection conn, DeliveryRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.id(), record.subscriptionId(), record.organizationId(), record.eventId(),
        record.eventType(), record.projectId(), record.applicationId(),
        record.incentiveProgramId(), record.payloadJson(), record.payloadHash(),
        record.status().code(), record.attemptCount(), record.maxAttempts(),
        millis(record.scheduledAt()), millis(record.nextRetryAt()), record.requestUrl(),
        record.responseStatusCode(), jsonCodec.toJsonObject(record.responseHeaders()),
        record.responseBody(), record.responseTimeMs(), record.errorMessage(),
        millis(record.sentAt()), millis(record.deliveredAt()), millis(record.failedAt()),
        millis(record.lockedAt()), record.replayOf(), millis(record.createdAt()));
  }

  @Override
  public Optional<DeliveryRecord> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, this::mapRecord, id).stream().findFirst();
  }

  @Override
  public List<DeliveryRecord> findByEventId(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE event_id=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, this::mapRecord, eventId);
  }

  @Override
  public List<DeliveryRecord> claimDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = millis(now);
    String token = newClaimToken();
    // Phase 1: UPDATE with subquery (H2-compatible default); the outer predicate re-checks due
    String claimSql = "UPDATE " + tableName() + " SET status=" + SENDING + ", locked_at=?, locked_by=? "
        + "WHERE id IN (SELECT id FROM " + tableName() + " WHERE " + DUE_CONDITION
        + " ORDER BY " + DUE_ORDER + " LIMIT ?) AND " + DUE_CONDITION;
    int updated = JdbcTemplate.update(conn, claimSql,
        nowMs, token, now, now, lockExpiry, limit, now, now, lockExpiry);
    if (updated == 0) return List.of();
    // Phase 2: SELECT rows claimed by this call
    return selectClaimed(conn, token);
  }

  /**
   * Selects the rows stamped with the given claim token. Shared by subclasses that use a
   * two-phase claim (UPDATE then SELECT).
   */
  protected List<DeliveryRecord> selectClaimed(Connection conn, String token) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE locked_by=? AND status=" + SENDING + " ORDER BY " + DUE_ORDER;
    return JdbcTemplate.query(conn, sql, this::mapRecord, token);
  }

  protected String newClaimToken() {
    return UUID.randomUUID().toString();
  }

  @Override
  public int recordAttempt(Connection conn, String id, DeliveryAttempt attempt) {
    boolean delivered = attempt.newStatus() == DeliveryStatus.DELIVERED;
    String completedColumn = delivered ? "delivered_at" : "failed_at";
    String sql = "UPDATE " + tableName() + " SET status=?, attempt_count=attempt_count+1,"
        + " next_retry_at=?, response_status_code=?, response_headers=?, response_body=?,"
        + " response_time_ms=?, error_message=?, sent_at=?, " + completedColumn + "=?,"
        + " locked_at=NULL, locked_by=NULL"
        + " WHERE id=? AND status=" + SENDING;
    return JdbcTemplate.update(conn, sql,
        attempt.newStatus().code(),
        millis(attempt.nextRetryAt()),
        attempt.responseStatusCode(),
        jsonCodec.toJsonObject(attempt.responseHeaders()),
        truncate(attempt.responseBody(), DeliveryRecord.MAX_RESPONSE_BODY_CHARS),
        attempt.responseTimeMs(),
        truncate(attempt.errorMessage(), DeliveryRecord.MAX_ERROR_MESSAGE_CHARS),
        millis(attempt.attemptedAt()),
        millis(attempt.completedAt()),
        id);
  }

  @Override
  public int markExhausted(Connection conn, String id, String error, Instant at) {
    String sql = "UPDATE " + tableName() + " SET status=" + quoted(DeliveryStatus.EXHAUSTED)
        + ", error_message=?, failed_at=?, next_retry_at=NULL, locked_at=NULL, locked_by=NULL"
        + " WHERE id=? AND status=" + SENDING;
    return JdbcTemplate.update(conn, sql,
        truncate(error, DeliveryRecord.MAX_ERROR_MESSAGE_CHARS), millis(at), id);
  }

  @Override
  public List<DeliveryRecord> queryExhausted(Connection conn, String subscriptionId, String eventType,
      boolean excludeReplayed, int limit) {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName() + " d")
        .append(" WHERE d.status=").append(quoted(DeliveryStatus.EXHAUSTED));
    List<Object> params = new ArrayList<>();
    if (subscriptionId != null) {
      sql.append(" AND d.subscription_id=?");
      params.add(subscriptionId);
    }
    if (eventType != null) {
      sql.append(" AND d.event_type=?");
      params.add(eventType);
    }
    if (excludeReplayed) {
      sql.append(" AND NOT EXISTS (SELECT 1 FROM ").append(tableName())
          .append(" r WHERE r.replay_of = d.id)");
    }
    sql.append(" ORDER BY d.failed_at, d.id LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), this::mapRecord, params.toArray());
  }

  @Override
  public long countExhausted(Connection conn, String subscriptionId) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE status=" + quoted(DeliveryStatus.EXHAUSTED);
    if (subscriptionId == null) {
      return JdbcTemplate.queryForLong(conn, sql);
    }
    return JdbcTemplate.queryForLong(conn, sql + " AND subscription_id=?", subscriptionId);
  }

  @Override
  public DeliveryStats statsSince(Connection conn, String subscriptionId, Instant since) {
    String sql = "SELECT COUNT(*) AS total,"
        + " SUM(CASE WHEN status=" + quoted(DeliveryStatus.DELIVERED) + " THEN 1 ELSE 0 END) AS delivered,"
        + " SUM(CASE WHEN status IN (" + quoted(DeliveryStatus.FAILED) + ","
        + quoted(DeliveryStatus.EXHAUSTED) + ") THEN 1 ELSE 0 END) AS failed"
        + " FROM " + tableName() + " WHERE subscription_id=? AND created_at >= ?";
    return JdbcTemplate.query(conn, sql,
            rs -> new DeliveryStats(rs.getLong("total"), rs.getLong("delivered"), rs.getLong("failed")),
            subscriptionId, millis(since))
        .stream()
        .findFirst()
        .orElse(DeliveryStats.EMPTY);
  }

  protected DeliveryRecord mapRecord(ResultSet rs) throws SQLException {
    return DeliveryRecord.builder()
        .id(rs.getString("id"))
        .subscriptionId(rs.getString("subscription_id"))
        .organizationId(rs.getString("organization_id"))
        .eventId(rs.getString("event_id"))
        .eventType(rs.getString("event_type"))
        .projectId(rs.getString("project_id"))
        .applicationId(rs.getString("application_id"))
        .incentiveProgramId(rs.getString("incentive_program_id"))
        .payloadJson(rs.getString("payload"))
        .payloadHash(rs.getString("payload_hash"))
        .status(DeliveryStatus.fromCode(rs.getString("status")))
        .attemptCount(rs.getInt("attempt_count"))
        .maxAttempts(rs.getInt("max_attempts"))
        .scheduledAt(JdbcTemplate.instant(rs, "scheduled_at"))
        .nextRetryAt(JdbcTemplate.instant(rs, "next_retry_at"))
        .requestUrl(rs.getString("request_url"))
        .responseStatusCode(JdbcTemplate.nullableInt(rs, "response_status_code"))
        .responseHeaders(jsonCodec.parseStringMap(rs.getString("response_headers")))
        .responseBody(rs.getString("response_body"))
        .responseTimeMs(JdbcTemplate.nullableLong(rs, "response_time_ms"))
        .errorMessage(rs.getString("error_message"))
        .sentAt(JdbcTemplate.instant(rs, "sent_at"))
        .deliveredAt(JdbcTemplate.instant(rs, "delivered_at"))
        .failedAt(JdbcTemplate.instant(rs, "failed_at"))
        .lockedAt(JdbcTemplate.instant(rs, "locked_at"))
        .replayOf(rs.getString("replay_of"))
        .createdAt(JdbcTemplate.instant(rs, "created_at"))
        .build();
  }

  protected static Instant millis(Instant instant) {
    return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
  }

  private static String quoted(DeliveryStatus status) {
    return "'" + status.code() + "'";
  }

  private static String truncate(String value, int maxChars) {
    if (value == null || value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars);
  }
}
