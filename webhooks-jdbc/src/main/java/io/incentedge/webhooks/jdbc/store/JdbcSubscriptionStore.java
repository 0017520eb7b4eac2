package io.incentedge.webhooks.jdbc.store;

import io.incentedge.webhooks.filter.FilterCriteria;
import io.incentedge.webhooks.jdbc.JdbcTemplate;
import io.incentedge.webhooks.jdbc.TableNames;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC subscription store using portable SQL, shared by all supported databases.
 *
 * <p>Subscribed event types live in a separate table keyed by
 * {@code (subscription_id, event_type)}; filters and custom headers are stored as JSON text.
 */
public final class JdbcSubscriptionStore implements SubscriptionStore {
  private static final String COLUMNS = "id, organization_id, name, description, url, secret, "
      + "filters, custom_headers, is_active, max_retries, last_triggered_at, last_success_at, "
      + "last_failure_at, success_count, failure_count, created_at";

  private final String subscriptionTable;
  private final String eventTable;
  private final JsonCodec jsonCodec;

  public JdbcSubscriptionStore() {
    this(TableNames.DEFAULT_SUBSCRIPTION_TABLE, TableNames.DEFAULT_SUBSCRIPTION_EVENT_TABLE,
        JsonCodec.getDefault());
  }

  public JdbcSubscriptionStore(String subscriptionTable, String eventTable, JsonCodec jsonCodec) {
    this.subscriptionTable = TableNames.validate(subscriptionTable);
    this.eventTable = TableNames.validate(eventTable);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void insert(Connection conn, Subscription s) {
    String sql = "INSERT INTO " + subscriptionTable + " (" + COLUMNS + ") "
        + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        s.id(), s.organizationId(), s.name(), s.description(), s.url(), s.secret(),
        s.filters().isEmpty() ? null : jsonCodec.toJson(s.filters()),
        jsonCodec.toJsonObject(s.customHeaders()),
        s.active(), s.maxRetries(),
        millis(s.lastTriggeredAt()), millis(s.lastSuccessAt()), millis(s.lastFailureAt()),
        s.successCount(), s.failureCount(), millis(s.createdAt()));
    String eventSql = "INSERT INTO " + eventTable + " (subscription_id, event_type) VALUES (?,?)";
    for (String eventType : s.events()) {
      JdbcTemplate.update(conn, eventSql, s.id(), eventType);
    }
  }

  @Override
  public Optional<Subscription> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + subscriptionTable + " WHERE id=?";
    return withEvents(conn, JdbcTemplate.query(conn, sql, this::mapRow, id)).stream().findFirst();
  }

  @Override
  public List<Subscription> findActiveByEventType(Connection conn, String organizationId, String eventType) {
    String sql = "SELECT " + prefixed("s") + " FROM " + subscriptionTable + " s"
        + " JOIN " + eventTable + " e ON e.subscription_id = s.id"
        + " WHERE s.organization_id=? AND s.is_active=? AND e.event_type=?"
        + " ORDER BY s.created_at, s.id";
    return withEvents(conn, JdbcTemplate.query(conn, sql, this::mapRow, organizationId, true, eventType));
  }

  @Override
  public List<Subscription> findByOrganization(Connection conn, String organizationId) {
    String sql = "SELECT " + COLUMNS + " FROM " + subscriptionTable
        + " WHERE organization_id=? ORDER BY created_at DESC, id DESC";
    return withEvents(conn, JdbcTemplate.query(conn, sql, this::mapRow, organizationId));
  }

  @Override
  public int markTriggered(Connection conn, String id, Instant at, boolean success) {
    String sql = success
        ? "UPDATE " + subscriptionTable + " SET last_triggered_at=?, last_success_at=?,"
            + " success_count=success_count+1 WHERE id=?"
        : "UPDATE " + subscriptionTable + " SET last_triggered_at=?, last_failure_at=?,"
            + " failure_count=failure_count+1 WHERE id=?";
    Instant atMs = millis(at);
    return JdbcTemplate.update(conn, sql, atMs, atMs, id);
  }

  @Override
  public int setActive(Connection conn, String id, boolean active) {
    return JdbcTemplate.update(conn,
        "UPDATE " + subscriptionTable + " SET is_active=? WHERE id=?", active, id);
  }

  @Override
  public int updateSecret(Connection conn, String id, String secret) {
    return JdbcTemplate.update(conn,
        "UPDATE " + subscriptionTable + " SET secret=? WHERE id=?", secret, id);
  }

  private Row mapRow(ResultSet rs) throws SQLException {
    String id = rs.getString("id");
    String filters = rs.getString("filters");
    return new Row(id, Subscription.builder()
        .id(id)
        .organizationId(rs.getString("organization_id"))
        .name(rs.getString("name"))
        .description(rs.getString("description"))
        .url(rs.getString("url"))
        .secret(rs.getString("secret"))
        .filters(filters == null ? FilterCriteria.EMPTY : jsonCodec.fromJson(filters, FilterCriteria.class))
        .customHeaders(jsonCodec.parseStringMap(rs.getString("custom_headers")))
        .active(rs.getBoolean("is_active"))
        .maxRetries(rs.getInt("max_retries"))
        .lastTriggeredAt(JdbcTemplate.instant(rs, "last_triggered_at"))
        .lastSuccessAt(JdbcTemplate.instant(rs, "last_success_at"))
        .lastFailureAt(JdbcTemplate.instant(rs, "last_failure_at"))
        .successCount(rs.getLong("success_count"))
        .failureCount(rs.getLong("failure_count"))
        .createdAt(JdbcTemplate.instant(rs, "created_at")));
  }

  /** Loads the event types of all given rows with one query and builds the subscriptions. */
  private List<Subscription> withEvents(Connection conn, List<Row> rows) {
    if (rows.isEmpty()) {
      return List.of();
    }
    Map<String, Subscription.Builder> byId = new LinkedHashMap<>();
    for (Row row : rows) {
      byId.put(row.id(), row.builder());
    }
    String placeholders = String.join(",", Collections.nCopies(byId.size(), "?"));
    String sql = "SELECT subscription_id, event_type FROM " + eventTable
        + " WHERE subscription_id IN (" + placeholders + ") ORDER BY subscription_id, event_type";
    Map<String, Set<String>> events = new LinkedHashMap<>();
    for (String[] pair : JdbcTemplate.query(conn, sql,
        rs -> new String[] {rs.getString("subscription_id"), rs.getString("event_type")},
        byId.keySet().toArray())) {
      events.computeIfAbsent(pair[0], k -> new LinkedHashSet<>()).add(pair[1]);
    }
    List<Subscription> result = new ArrayList<>(byId.size());
    for (Map.Entry<String, Subscription.Builder> entry : byId.entrySet()) {
      result.add(entry.getValue().events(events.getOrDefault(entry.getKey(), Set.of())).build());
    }
    return result;
  }

  private record Row(String id, Subscription.Builder builder) {}

  private static String prefixed(String alias) {
    return alias + "." + COLUMNS.replace(", ", ", " + alias + ".");
  }

  private static Instant millis(Instant instant) {
    return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
  }
}
