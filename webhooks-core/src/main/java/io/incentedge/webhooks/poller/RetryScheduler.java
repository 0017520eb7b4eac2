package io.incentedge.webhooks.poller;

import io.incentedge.webhooks.delivery.DeliveryEngine;
import io.incentedge.webhooks.model.DeliveryFailure;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.MetricsExporter;
import io.incentedge.webhooks.spi.SubscriptionStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends due delivery records: new records left by queued dispatch, records waiting for a
 * retry, and records whose sender died mid-attempt.
 *
 * <p>Each run claims at most {@code batchSize} records with a conditional update, so
 * concurrent or overlapping runs (several instances, or a cron firing twice) never send
 * the same record twice. Records whose subscription was deactivated or deleted are moved
 * to {@code exhausted} without an attempt.
 *
 * <p>{@link #processRetries()} never throws; failures are logged and counted.
 *
 * @see RetryPoller
 */
public final class RetryScheduler {
    private static final Logger logger = Logger.getLogger(RetryScheduler.class.getName());

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(5);

    private final ConnectionProvider connectionProvider;
    private final DeliveryStore deliveryStore;
    private final SubscriptionStore subscriptionStore;
    private final DeliveryEngine engine;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final int batchSize;
    private final Duration lockTimeout;

    private RetryScheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
        this.subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        Objects.requireNonNull(builder.lockTimeout, "lockTimeout");
        if (builder.lockTimeout.isNegative() || builder.lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        this.batchSize = builder.batchSize;
        this.lockTimeout = builder.lockTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Claims and sends one batch of due records.
     *
     * @return counts for this run; {@link RetryBatchResult#EMPTY} if nothing was due or the
     *         claim failed
     */
    public RetryBatchResult processRetries() {
        Instant now = clock.instant();
        List<DeliveryRecord> claimed = claimDue(now);
        if (claimed.isEmpty()) {
            return RetryBatchResult.EMPTY;
        }
        metrics.recordRetryClaimed(claimed.size());

        int succeeded = 0;
        int failed = 0;
        Map<String, Optional<Subscription>> subscriptions = new HashMap<>();
        for (DeliveryRecord record : claimed) {
            try {
                Optional<Subscription> subscription = subscriptions.computeIfAbsent(
                        record.subscriptionId(), this::findSubscription);
                if (subscription.isEmpty() || !subscription.get().active()) {
                    exhaustInactive(record);
                    failed++;
                    continue;
                }
                DeliveryOutcome outcome = engine.attempt(subscription.get(), record);
                if (outcome.isSuccess()) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Retry failed for delivery " + record.id(), e);
                failed++;
            }
        }
        logger.log(Level.FINE, "Retry run processed {0}: {1} delivered, {2} failed",
                new Object[] {claimed.size(), succeeded, failed});
        return new RetryBatchResult(claimed.size(), succeeded, failed);
    }

    private List<DeliveryRecord> claimDue(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            // H2 and MySQL claim with UPDATE then SELECT; both must see one transaction
            conn.setAutoCommit(false);
            try {
                List<DeliveryRecord> claimed = deliveryStore.claimDue(conn, now, now.minus(lockTimeout), batchSize);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to claim due deliveries", e);
            return List.of();
        }
    }

    private Optional<Subscription> findSubscription(String subscriptionId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return subscriptionStore.findById(conn, subscriptionId);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load subscription " + subscriptionId, e);
        }
    }

    private void exhaustInactive(DeliveryRecord record) {
        DeliveryFailure failure = new DeliveryFailure.SubscriptionInactive();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int updated = deliveryStore.markExhausted(conn, record.id(), failure.message(), clock.instant());
            if (updated == 0) {
                logger.log(Level.SEVERE, "Lost update: delivery " + record.id()
                        + " was no longer sending when exhausting it");
                return;
            }
            metrics.incrementDeliveryExhausted();
            logger.log(Level.WARNING, "Delivery " + record.id() + " exhausted: subscription "
                    + record.subscriptionId() + " is inactive or deleted");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to exhaust delivery " + record.id(), e);
        }
    }

    /**
     * Builder for {@link RetryScheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeliveryStore deliveryStore;
        private SubscriptionStore subscriptionStore;
        private DeliveryEngine engine;
        private MetricsExporter metrics;
        private Clock clock;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param deliveryStore store used to claim and exhaust records
         * @return this builder
         */
        public Builder deliveryStore(DeliveryStore deliveryStore) {
            this.deliveryStore = deliveryStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param subscriptionStore store used to load the owning subscription
         * @return this builder
         */
        public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
            this.subscriptionStore = subscriptionStore;
            return this;
        }

        /**
         * <p><b>Required.</b>
         *
         * @param engine performs and records each attempt
         * @return this builder
         */
        public Builder engine(DeliveryEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the maximum number of records claimed per run.
         *
         * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
         *
         * @param batchSize max records per run
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets how long a {@code sending} record may stay claimed before another run takes
         * it over.
         *
         * <p>Optional. Defaults to 5 minutes. Must be longer than the delivery timeout.
         *
         * @param lockTimeout lease length
         * @return this builder
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public RetryScheduler build() {
            return new RetryScheduler(this);
        }
    }
}
