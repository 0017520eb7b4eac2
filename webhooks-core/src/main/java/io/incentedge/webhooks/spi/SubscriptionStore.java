package io.incentedge.webhooks.spi;

import io.incentedge.webhooks.model.Subscription;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for webhook subscriptions.
 *
 * <p>All methods receive an explicit {@link Connection}; implementations never commit or
 * close it. Implementations live in the {@code webhooks-jdbc} module.
 *
 * @see io.incentedge.webhooks.jdbc.store.JdbcSubscriptionStore
 */
public interface SubscriptionStore {

    /**
     * Inserts a new subscription together with its event types.
     *
     * @param conn         the JDBC connection
     * @param subscription the subscription to persist
     */
    void insert(Connection conn, Subscription subscription);

    /**
     * Looks up a subscription by id, active or not.
     *
     * @param conn the JDBC connection
     * @param id   subscription id
     * @return the subscription, or empty if it does not exist
     */
    Optional<Subscription> findById(Connection conn, String id);

    /**
     * Returns the active subscriptions of an organization that subscribe to an event type.
     *
     * @param conn           the JDBC connection
     * @param organizationId owning organization
     * @param eventType      event-type wire name
     * @return matching subscriptions, oldest first
     */
    List<Subscription> findActiveByEventType(Connection conn, String organizationId, String eventType);

    /**
     * Returns all subscriptions of an organization, newest first.
     *
     * @param conn           the JDBC connection
     * @param organizationId owning organization
     * @return subscriptions, possibly empty
     */
    List<Subscription> findByOrganization(Connection conn, String organizationId);

    /**
     * Records that a delivery attempt completed: sets {@code last_triggered_at} and either
     * {@code last_success_at} with the success counter or {@code last_failure_at} with the
     * failure counter.
     *
     * @param conn    the JDBC connection
     * @param id      subscription id
     * @param at      completion time of the attempt
     * @param success whether the attempt succeeded
     * @return the number of rows updated (0 or 1)
     */
    int markTriggered(Connection conn, String id, Instant at, boolean success);

    /**
     * Activates or deactivates a subscription.
     *
     * @return the number of rows updated (0 or 1)
     */
    int setActive(Connection conn, String id, boolean active);

    /**
     * Replaces the signing secret.
     *
     * @return the number of rows updated (0 or 1)
     */
    int updateSecret(Connection conn, String id, String secret);
}
