package io.incentedge.webhooks.spring.boot;

import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.delivery.DeliveryHeaders;
import io.incentedge.webhooks.jdbc.TableNames;
import io.incentedge.webhooks.retry.ExponentialBackoffRetryPolicy;
import io.incentedge.webhooks.signature.WebhookSigner;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for webhook dispatch and delivery.
 *
 * @see WebhookAutoConfiguration
 */
@ConfigurationProperties(prefix = "incentedge.webhooks")
public class WebhookProperties {

    /**
     * Product name used in the {@code User-Agent} and {@code X-<Product>-*} headers.
     */
    private String productName = DeliveryHeaders.DEFAULT_PRODUCT_NAME;

    /**
     * API version stamped into every event envelope.
     */
    private String apiVersion = EventEnvelope.DEFAULT_API_VERSION;

    private final Tables tables = new Tables();
    private final Delivery delivery = new Delivery();
    private final Retry retry = new Retry();
    private final Scheduler scheduler = new Scheduler();
    private final Signature signature = new Signature();
    private final Metrics metrics = new Metrics();

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public Tables getTables() {
        return tables;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Retry getRetry() {
        return retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Signature getSignature() {
        return signature;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String subscription = TableNames.DEFAULT_SUBSCRIPTION_TABLE;
        private String subscriptionEvent = TableNames.DEFAULT_SUBSCRIPTION_EVENT_TABLE;
        private String delivery = TableNames.DEFAULT_DELIVERY_TABLE;

        public String getSubscription() {
            return subscription;
        }

        public void setSubscription(String subscription) {
            this.subscription = subscription;
        }

        public String getSubscriptionEvent() {
            return subscriptionEvent;
        }

        public void setSubscriptionEvent(String subscriptionEvent) {
            this.subscriptionEvent = subscriptionEvent;
        }

        public String getDelivery() {
            return delivery;
        }

        public void setDelivery(String delivery) {
            this.delivery = delivery;
        }
    }

    public static class Delivery {
        private Duration timeout = Duration.ofSeconds(30);
        /**
         * Threads for immediate dispatch; {@code 0} delivers on the calling thread.
         */
        private int workerCount = 4;
        private long drainTimeoutMs = 35_000;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        private long baseDelayMs = ExponentialBackoffRetryPolicy.DEFAULT_BASE_DELAY_MS;
        private long maxDelayMs = ExponentialBackoffRetryPolicy.DEFAULT_MAX_DELAY_MS;
        private double multiplier = ExponentialBackoffRetryPolicy.DEFAULT_MULTIPLIER;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    public static class Scheduler {
        /**
         * Runs the retry scheduler in-process. Leave disabled when an external cron calls
         * {@code processRetries()}.
         */
        private boolean enabled = false;
        private long intervalMs = 60_000;
        private int batchSize = 100;
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Signature {
        private Duration tolerance = WebhookSigner.DEFAULT_TOLERANCE;

        public Duration getTolerance() {
            return tolerance;
        }

        public void setTolerance(Duration tolerance) {
            this.tolerance = tolerance;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "webhooks";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
