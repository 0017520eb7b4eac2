package io.incentedge.webhooks.exhausted;

import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting and replaying exhausted deliveries.
 *
 * <p>Replay never modifies the exhausted record. It inserts a new {@code pending} record
 * with the same event id and payload bytes, a fresh attempt budget, and {@code replay_of}
 * pointing at the original. The retry scheduler sends it on its next run.
 *
 * @see DeliveryStore#queryExhausted
 * @see DeliveryStore#countExhausted
 */
public final class ExhaustedDeliveryManager {
  private static final Logger logger = Logger.getLogger(ExhaustedDeliveryManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final Clock clock;

  public ExhaustedDeliveryManager(ConnectionProvider connectionProvider, DeliveryStore deliveryStore) {
    this(connectionProvider, deliveryStore, Clock.systemUTC());
  }

  public ExhaustedDeliveryManager(ConnectionProvider connectionProvider, DeliveryStore deliveryStore,
      Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Queries exhausted deliveries with optional filters.
   *
   * @param subscriptionId optional subscription filter ({@code null} for all)
   * @param eventType      optional event type filter ({@code null} for all)
   * @param limit          maximum number of records to return
   * @return exhausted records with their last error, oldest first
   */
  public List<DeliveryRecord> query(String subscriptionId, String eventType, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.queryExhausted(conn, subscriptionId, eventType, false, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query exhausted deliveries", e);
      return List.of();
    }
  }

  /**
   * Schedules a new delivery of an exhausted record.
   *
   * @param deliveryId id of the exhausted record
   * @return the new pending record, or empty if the id is unknown or not exhausted
   */
  public Optional<DeliveryRecord> replay(String deliveryId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Optional<DeliveryRecord> original = deliveryStore.findById(conn, deliveryId)
          .filter(r -> r.status() == DeliveryStatus.EXHAUSTED);
      if (original.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(insertReplay(conn, original.get()));
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to replay delivery: " + deliveryId, e);
      return Optional.empty();
    }
  }

  /**
   * Replays every exhausted delivery matching the filters that has not been replayed yet,
   * processing in batches.
   *
   * @param subscriptionId optional subscription filter ({@code null} for all)
   * @param eventType      optional event type filter ({@code null} for all)
   * @param batchSize      number of records to process per batch
   * @return total number of records replayed
   */
  public int replayAll(String subscriptionId, String eventType, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int totalReplayed = 0;
    List<DeliveryRecord> batch;
    do {
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        batch = deliveryStore.queryExhausted(conn, subscriptionId, eventType, true, batchSize);
        for (DeliveryRecord record : batch) {
          insertReplay(conn, record);
          totalReplayed++;
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to replay exhausted deliveries batch", e);
        break;
      }
    } while (batch.size() >= batchSize);
    return totalReplayed;
  }

  /**
   * Counts exhausted deliveries, optionally for one subscription.
   *
   * @param subscriptionId optional subscription filter ({@code null} for all)
   * @return the number of exhausted records
   */
  public long count(String subscriptionId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.countExhausted(conn, subscriptionId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count exhausted deliveries", e);
      return 0;
    }
  }

  private DeliveryRecord insertReplay(Connection conn, DeliveryRecord original) {
    Instant now = clock.instant();
    DeliveryRecord replay = DeliveryRecord.builder()
        .id(Ids.newId())
        .subscriptionId(original.subscriptionId())
        .organizationId(original.organizationId())
        .eventId(original.eventId())
        .eventType(original.eventType())
        .projectId(original.projectId())
        .applicationId(original.applicationId())
        .incentiveProgramId(original.incentiveProgramId())
        .payloadJson(original.payloadJson())
        .payloadHash(original.payloadHash())
        .status(DeliveryStatus.PENDING)
        .attemptCount(0)
        .maxAttempts(original.maxAttempts())
        .scheduledAt(now)
        .requestUrl(original.requestUrl())
        .replayOf(original.id())
        .createdAt(now)
        .build();
    deliveryStore.insertNew(conn, replay);
    logger.log(Level.INFO, "Replaying delivery {0} as {1}", new Object[] {original.id(), replay.id()});
    return replay;
  }
}
