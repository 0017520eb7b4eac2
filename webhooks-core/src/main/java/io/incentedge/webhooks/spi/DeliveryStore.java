package io.incentedge.webhooks.spi;

import io.incentedge.webhooks.model.DeliveryAttempt;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStats;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for delivery records, managing status transitions
 * through the lifecycle: pending → sending → delivered, sending → retrying → sending, or
 * sending → exhausted.
 *
 * <p>Every status-changing update is conditional on the record being in {@code sending}, so
 * a record that another worker already finished is never overwritten. All methods receive
 * an explicit {@link Connection}. Implementations live in the {@code webhooks-jdbc} module.
 *
 * @see io.incentedge.webhooks.jdbc.store.AbstractJdbcDeliveryStore
 */
public interface DeliveryStore {

    /**
     * Inserts a new record in its initial status ({@code pending}, or {@code sending} with a
     * lease for immediate delivery).
     *
     * @param conn   the JDBC connection
     * @param record the record to persist
     */
    void insertNew(Connection conn, DeliveryRecord record);

    /**
     * Looks up a record by id.
     *
     * @param conn the JDBC connection
     * @param id   record id
     * @return the record, or empty if it does not exist
     */
    Optional<DeliveryRecord> findById(Connection conn, String id);

    /**
     * Returns all records created for one event, one per subscription.
     *
     * @param conn    the JDBC connection
     * @param eventId envelope id
     * @return records, oldest first
     */
    List<DeliveryRecord> findByEventId(Connection conn, String eventId);

    /**
     * Claims due records by moving them to {@code sending} and stamping {@code locked_at}.
     *
     * <p>A record is due when it is {@code pending} with {@code scheduled_at <= now},
     * {@code retrying} with {@code next_retry_at <= now}, or {@code sending} with a lease
     * older than {@code lockExpiry} (a worker died mid-attempt). Each claim is a
     * compare-and-set: a record claimed by a concurrent caller is not returned.
     *
     * @param conn       the JDBC connection
     * @param now        current time, used as due cutoff and lease start
     * @param lockExpiry leases that started before this instant are considered abandoned
     * @param limit      maximum number of records to claim
     * @return the claimed records as they are after the claim, ordered by
     *         {@code next_retry_at}, falling back to {@code scheduled_at}
     */
    List<DeliveryRecord> claimDue(Connection conn, Instant now, Instant lockExpiry, int limit);

    /**
     * Applies the outcome of an attempt to a record in {@code sending}: sets the new status,
     * response metadata and timestamps, increments {@code attempt_count} and releases the
     * lease.
     *
     * @param conn    the JDBC connection
     * @param id      record id
     * @param attempt the attempt outcome
     * @return the number of rows updated (0 if the record was no longer {@code sending})
     */
    int recordAttempt(Connection conn, String id, DeliveryAttempt attempt);

    /**
     * Moves a claimed record to {@code exhausted} without counting an attempt.
     *
     * @param conn  the JDBC connection
     * @param id    record id
     * @param error reason stored in {@code error_message}
     * @param at    failure time
     * @return the number of rows updated (0 if the record was no longer {@code sending})
     */
    int markExhausted(Connection conn, String id, String error, Instant at);

    /**
     * Lists exhausted records, oldest failure first.
     *
     * @param conn            the JDBC connection
     * @param subscriptionId  restrict to one subscription, or {@code null} for all
     * @param eventType       restrict to one event type, or {@code null} for all
     * @param excludeReplayed skip records that some other record already replays
     * @param limit           maximum number of records
     * @return exhausted records
     */
    List<DeliveryRecord> queryExhausted(Connection conn, String subscriptionId, String eventType,
                                        boolean excludeReplayed, int limit);

    /**
     * Counts exhausted records.
     *
     * @param conn           the JDBC connection
     * @param subscriptionId restrict to one subscription, or {@code null} for all
     * @return the count
     */
    long countExhausted(Connection conn, String subscriptionId);

    /**
     * Counts a subscription's records created at or after {@code since}.
     *
     * @param conn           the JDBC connection
     * @param subscriptionId subscription id
     * @param since          start of the window
     * @return totals for the window
     */
    DeliveryStats statsSince(Connection conn, String subscriptionId, Instant since);
}
