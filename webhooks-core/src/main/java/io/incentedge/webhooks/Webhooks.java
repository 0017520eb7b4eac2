package io.incentedge.webhooks;

import io.incentedge.webhooks.delivery.DeliveryEngine;
import io.incentedge.webhooks.delivery.DeliveryHeaders;
import io.incentedge.webhooks.delivery.WebhookTestSender;
import io.incentedge.webhooks.dispatch.DispatchOptions;
import io.incentedge.webhooks.dispatch.DispatchResult;
import io.incentedge.webhooks.dispatch.WebhookDispatcher;
import io.incentedge.webhooks.dispatch.WebhookEvents;
import io.incentedge.webhooks.exhausted.ExhaustedDeliveryManager;
import io.incentedge.webhooks.poller.RetryBatchResult;
import io.incentedge.webhooks.poller.RetryPoller;
import io.incentedge.webhooks.poller.RetryScheduler;
import io.incentedge.webhooks.retry.RetryPolicy;
import io.incentedge.webhooks.signature.WebhookSigner;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.MetricsExporter;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.spi.WebhookTransport;
import io.incentedge.webhooks.subscription.SubscriptionManager;
import io.incentedge.webhooks.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link WebhookDispatcher}, {@link RetryScheduler}
 * (optionally driven by a {@link RetryPoller}) and the management facades into a single
 * {@link AutoCloseable} unit sharing one {@link DeliveryEngine}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Webhooks webhooks = Webhooks.builder()
 *     .connectionProvider(connProvider)
 *     .subscriptionStore(subscriptionStore)
 *     .deliveryStore(deliveryStore)
 *     .build()) {
 *   webhooks.dispatch("project.created", data, orgId, DispatchOptions.DEFAULT);
 *   // an external cron calls webhooks.processRetries()
 * }
 * }</pre>
 */
public final class Webhooks implements AutoCloseable {
  private final WebhookDispatcher dispatcher;
  private final WebhookEvents events;
  private final RetryScheduler retryScheduler;
  private final RetryPoller poller;
  private final ExhaustedDeliveryManager exhaustedDeliveries;
  private final WebhookTestSender testSender;
  private final SubscriptionManager subscriptions;
  private final WebhookSigner signer;
  private final MetricsExporter metrics;

  private Webhooks(Builder builder, WebhookDispatcher dispatcher, RetryScheduler retryScheduler,
      RetryPoller poller, WebhookTestSender testSender, WebhookSigner signer) {
    this.dispatcher = dispatcher;
    this.events = new WebhookEvents(dispatcher);
    this.retryScheduler = retryScheduler;
    this.poller = poller;
    this.exhaustedDeliveries = new ExhaustedDeliveryManager(
        builder.connectionProvider, builder.deliveryStore, builder.clock);
    this.testSender = testSender;
    this.subscriptions = new SubscriptionManager(
        builder.connectionProvider, builder.subscriptionStore, builder.deliveryStore, builder.clock);
    this.signer = signer;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shortcut for {@link WebhookDispatcher#dispatch(String, Object, String, DispatchOptions)}. */
  public DispatchResult dispatch(String eventType, Object data, String organizationId,
      DispatchOptions options) {
    return dispatcher.dispatch(eventType, data, organizationId, options);
  }

  /** Shortcut for {@link RetryScheduler#processRetries()}. */
  public RetryBatchResult processRetries() {
    return retryScheduler.processRetries();
  }

  public WebhookDispatcher dispatcher() {
    return dispatcher;
  }

  public WebhookEvents events() {
    return events;
  }

  public RetryScheduler retryScheduler() {
    return retryScheduler;
  }

  /** The in-process poller, or {@code null} when retries are driven externally. */
  public RetryPoller poller() {
    return poller;
  }

  public ExhaustedDeliveryManager exhaustedDeliveries() {
    return exhaustedDeliveries;
  }

  public WebhookTestSender testSender() {
    return testSender;
  }

  public SubscriptionManager subscriptions() {
    return subscriptions;
  }

  /** Signer configured with the same tolerance, for verifying inbound test traffic. */
  public WebhookSigner signer() {
    return signer;
  }

  /**
   * Shuts down components in order: poller, dispatcher, then the metrics exporter if it is
   * closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (poller != null) {
      try {
        poller.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Webhooks}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore subscriptionStore;
    private DeliveryStore deliveryStore;
    private WebhookTransport transport;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private JsonCodec jsonCodec;
    private Clock clock = Clock.systemUTC();
    private String productName = DeliveryHeaders.DEFAULT_PRODUCT_NAME;
    private String apiVersion = EventEnvelope.DEFAULT_API_VERSION;
    private Duration deliveryTimeout = DeliveryEngine.DEFAULT_TIMEOUT;
    private Duration signatureTolerance = WebhookSigner.DEFAULT_TOLERANCE;
    private int workerCount = 4;
    private long drainTimeoutMs = 35_000;
    private int batchSize = RetryScheduler.DEFAULT_BATCH_SIZE;
    private Duration lockTimeout = RetryScheduler.DEFAULT_LOCK_TIMEOUT;
    private long pollIntervalMs = RetryPoller.DEFAULT_INTERVAL_MS;
    private boolean pollerEnabled;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder subscriptionStore(SubscriptionStore subscriptionStore) {
      this.subscriptionStore = subscriptionStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryStore(DeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder productName(String productName) {
      this.productName = productName;
      return this;
    }

    public Builder apiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public Builder deliveryTimeout(Duration deliveryTimeout) {
      this.deliveryTimeout = deliveryTimeout;
      return this;
    }

    public Builder signatureTolerance(Duration signatureTolerance) {
      this.signatureTolerance = signatureTolerance;
      return this;
    }

    /** Threads for immediate dispatch. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /** Records claimed per scheduler run. Defaults to {@code 100}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Lease after which a {@code sending} record is reclaimed. Defaults to 5 minutes. */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * Starts an in-process {@link RetryPoller} with the given interval instead of relying on
     * an external scheduler.
     *
     * @param intervalMs delay between runs in milliseconds
     * @return this builder
     */
    public Builder poller(long intervalMs) {
      this.pollerEnabled = true;
      this.pollIntervalMs = intervalMs;
      return this;
    }

    /**
     * Builds and, if a poller was requested, starts the components.
     *
     * @throws IllegalStateException if build() was already called
     */
    public Webhooks build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(subscriptionStore, "subscriptionStore");
      Objects.requireNonNull(deliveryStore, "deliveryStore");

      WebhookSigner signer = new WebhookSigner(clock, signatureTolerance);
      EnvelopeFormatter formatter = new EnvelopeFormatter(
          jsonCodec != null ? jsonCodec : JsonCodec.getDefault(), apiVersion, clock);
      DeliveryEngine engine = DeliveryEngine.builder()
          .connectionProvider(connectionProvider)
          .deliveryStore(deliveryStore)
          .subscriptionStore(subscriptionStore)
          .transport(transport)
          .signer(signer)
          .retryPolicy(retryPolicy)
          .metrics(metrics)
          .productName(productName)
          .timeout(deliveryTimeout)
          .clock(clock)
          .build();
      RetryScheduler retryScheduler = RetryScheduler.builder()
          .connectionProvider(connectionProvider)
          .deliveryStore(deliveryStore)
          .subscriptionStore(subscriptionStore)
          .engine(engine)
          .metrics(metrics)
          .clock(clock)
          .batchSize(batchSize)
          .lockTimeout(lockTimeout)
          .build();
      WebhookDispatcher dispatcher = WebhookDispatcher.builder()
          .connectionProvider(connectionProvider)
          .subscriptionStore(subscriptionStore)
          .deliveryStore(deliveryStore)
          .engine(engine)
          .formatter(formatter)
          .metrics(metrics)
          .clock(clock)
          .workerCount(workerCount)
          .drainTimeoutMs(drainTimeoutMs)
          .build();

      RetryPoller poller = null;
      if (pollerEnabled) {
        try {
          poller = new RetryPoller(retryScheduler, pollIntervalMs);
          poller.start();
        } catch (RuntimeException e) {
          dispatcher.close();
          throw e;
        }
      }
      WebhookTestSender testSender = new WebhookTestSender(
          connectionProvider, subscriptionStore, deliveryStore, formatter, engine, clock);
      return new Webhooks(this, dispatcher, retryScheduler, poller, testSender, signer);
    }
  }
}
