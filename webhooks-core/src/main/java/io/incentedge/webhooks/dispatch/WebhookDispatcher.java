package io.incentedge.webhooks.dispatch;

import io.incentedge.webhooks.EnvelopeFormatter;
import io.incentedge.webhooks.EventEnvelope;
import io.incentedge.webhooks.WebhookEventType;
import io.incentedge.webhooks.WebhookResolutionException;
import io.incentedge.webhooks.delivery.DeliveryEngine;
import io.incentedge.webhooks.model.DeliveryOutcome;
import io.incentedge.webhooks.model.DeliveryRecord;
import io.incentedge.webhooks.model.DeliveryStatus;
import io.incentedge.webhooks.model.Subscription;
import io.incentedge.webhooks.spi.ConnectionProvider;
import io.incentedge.webhooks.spi.DeliveryStore;
import io.incentedge.webhooks.spi.MetricsExporter;
import io.incentedge.webhooks.spi.SubscriptionStore;
import io.incentedge.webhooks.util.DaemonThreadFactory;
import io.incentedge.webhooks.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans an event out to every matching subscription of an organization.
 *
 * <p>Each call formats one envelope, serializes it once, resolves the active subscribers,
 * evaluates their filters and creates one delivery record per match. Records start in
 * {@code pending} and are picked up by the retry scheduler, or, for immediate dispatch, in
 * {@code sending} and are attempted on a bounded worker pool before {@code dispatch}
 * returns.
 *
 * <p>A failure for one subscriber is recorded in {@link DispatchResult#errors()} and never
 * stops the others. Only a failure to resolve subscribers is thrown.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to shut down the worker pool.
 */
public final class WebhookDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WebhookDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final SubscriptionResolver resolver;
  private final EnvelopeFormatter formatter;
  private final DeliveryEngine engine;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ExecutorService workers;
  private final long drainTimeoutMs;
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private WebhookDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    SubscriptionStore subscriptionStore = Objects.requireNonNull(builder.subscriptionStore, "subscriptionStore");
    this.resolver = new SubscriptionResolver(subscriptionStore);
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.formatter = builder.formatter != null ? builder.formatter : new EnvelopeFormatter();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    // workerCount=0 sends on the calling thread
    this.workers = builder.workerCount > 0
        ? Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("webhook-delivery-"))
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Dispatches a known event type.
   *
   * @see #dispatch(String, Object, String, DispatchOptions)
   */
  public DispatchResult dispatch(WebhookEventType eventType, Object data, String organizationId,
      DispatchOptions options) {
    return dispatch(Objects.requireNonNull(eventType, "eventType").wireName(), data, organizationId, options);
  }

  /**
   * Creates delivery records for every matching subscription and, if requested, sends them.
   *
   * @param eventType      event-type wire name
   * @param data           event data: a map, record or bean
   * @param organizationId owning organization
   * @param options        correlation ids, actor and immediacy; {@code null} for defaults
   * @return the envelope id, records created, and per-subscriber errors
   * @throws WebhookResolutionException if the subscribers cannot be read
   * @throws IllegalArgumentException   if the event type is blank or {@code data} is not an object
   * @throws IllegalStateException      if the dispatcher is closed
   */
  public DispatchResult dispatch(String eventType, Object data, String organizationId,
      DispatchOptions options) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(organizationId, "organizationId");
    if (eventType.isBlank()) {
      throw new IllegalArgumentException("eventType cannot be blank");
    }
    if (!accepting.get()) {
      throw new IllegalStateException("Dispatcher is closed");
    }
    DispatchOptions opts = options != null ? options : DispatchOptions.DEFAULT;
    if (!WebhookEventType.isKnown(eventType)) {
      logger.log(Level.FINE, "Dispatching unregistered event type {0}", eventType);
    }

    EventEnvelope envelope = formatter.format(eventType, data, organizationId, opts.toMetadata());
    String payloadJson = formatter.serialize(envelope);
    String payloadHash = DeliveryRecord.sha256Hex(payloadJson);

    List<DispatchError> errors = new ArrayList<>();
    List<Pending> created = new ArrayList<>();
    boolean resolved = false;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<Subscription> subscriptions = resolveSubscribers(conn, organizationId, eventType);
      resolved = true;
      for (Subscription subscription : subscriptions) {
        if (!resolver.accepts(subscription, envelope)) {
          metrics.incrementFiltered();
          continue;
        }
        DeliveryRecord record = newRecord(subscription, envelope, payloadJson, payloadHash, opts);
        try {
          deliveryStore.insertNew(conn, record);
          created.add(new Pending(subscription, record));
          metrics.incrementRecordsCreated();
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Failed to create delivery for subscription " + subscription.id()
              + " event " + envelope.id(), e);
          errors.add(new DispatchError(subscription.id(), "Failed to queue event: " + e.getMessage()));
        }
      }
    } catch (SQLException e) {
      if (!resolved) {
        throw new WebhookResolutionException(organizationId, eventType, e);
      }
      logger.log(Level.WARNING, "Error closing connection after dispatch of " + envelope.id(), e);
    }

    List<DeliveryOutcome> outcomes = opts.immediate() ? sendAll(created, errors) : List.of();
    logger.log(Level.FINE, "Dispatched {0} {1}: {2} records, {3} errors",
        new Object[] {eventType, envelope.id(), created.size(), errors.size()});
    return new DispatchResult(envelope.id(), created.size(), errors, outcomes);
  }

  private List<Subscription> resolveSubscribers(Connection conn, String organizationId, String eventType) {
    try {
      return resolver.resolve(conn, organizationId, eventType);
    } catch (RuntimeException e) {
      throw new WebhookResolutionException(organizationId, eventType, e);
    }
  }

  private DeliveryRecord newRecord(Subscription subscription, EventEnvelope envelope, String payloadJson,
      String payloadHash, DispatchOptions opts) {
    Instant now = clock.instant();
    return DeliveryRecord.builder()
        .id(Ids.newId())
        .subscriptionId(subscription.id())
        .organizationId(envelope.organizationId())
        .eventId(envelope.id())
        .eventType(envelope.event())
        .projectId(opts.projectId())
        .applicationId(opts.applicationId())
        .incentiveProgramId(opts.incentiveProgramId())
        .payloadJson(payloadJson)
        .payloadHash(payloadHash)
        .status(opts.immediate() ? DeliveryStatus.SENDING : DeliveryStatus.PENDING)
        .attemptCount(0)
        .maxAttempts(subscription.maxAttempts())
        .scheduledAt(now)
        .lockedAt(opts.immediate() ? now : null)
        .requestUrl(subscription.url())
        .createdAt(now)
        .build();
  }

  private List<DeliveryOutcome> sendAll(List<Pending> created, List<DispatchError> errors) {
    List<DeliveryOutcome> outcomes = new ArrayList<>(created.size());
    if (workers == null) {
      for (Pending pending : created) {
        outcomes.add(engine.attempt(pending.subscription(), pending.record()));
      }
      return outcomes;
    }

    List<Future<DeliveryOutcome>> futures = new ArrayList<>(created.size());
    for (Pending pending : created) {
      try {
        futures.add(workers.submit(() -> engine.attempt(pending.subscription(), pending.record())));
      } catch (RejectedExecutionException e) {
        // record stays sending; the scheduler picks it up after the lock timeout
        futures.add(null);
        errors.add(new DispatchError(pending.subscription().id(), "Dispatcher is shutting down"));
      }
    }
    for (int i = 0; i < futures.size(); i++) {
      Future<DeliveryOutcome> future = futures.get(i);
      if (future == null) {
        continue;
      }
      String subscriptionId = created.get(i).subscription().id();
      try {
        outcomes.add(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        errors.add(new DispatchError(subscriptionId, "Interrupted while waiting for delivery"));
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Delivery attempt failed for subscription " + subscriptionId, e.getCause());
        errors.add(new DispatchError(subscriptionId, "Error sending event: " + e.getCause()));
      }
    }
    return outcomes;
  }

  /**
   * Stops accepting events and waits up to the drain timeout for in-flight sends.
   */
  @Override
  public void close() {
    accepting.set(false);
    if (workers == null) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting in-flight deliveries");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private record Pending(Subscription subscription, DeliveryRecord record) {}

  /** Builder for {@link WebhookDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private SubscriptionStore subscriptionStore;
    private DeliveryStore deliveryStore;
    private DeliveryEngine engine;
    private EnvelopeFormatter formatter;
    private MetricsExporter metrics;
    private Clock clock;
    private int workerCount = 4;
    private long drainTimeoutMs = 35_000;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider connections for resolution and record creation
     * @return this builder
     */
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

    /**
     * <b>Required.</b> Sends immediate deliveries.
     *
     * @param engine the delivery engine
     * @return this builder
     */
    public Builder engine(DeliveryEngine engine) {
      this.engine = engine;
      return this;
    }

    /** Optional. Defaults to a formatter with the default codec and API version. */
    public Builder formatter(EnvelopeFormatter formatter) {
      this.formatter = formatter;
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
     * Optional. Threads for immediate sends. Defaults to {@code 4}; {@code 0} sends on the
     * calling thread one subscriber at a time.
     *
     * @param workerCount pool size
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Optional. How long {@link #close()} waits for in-flight sends. Defaults to 35 s. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public WebhookDispatcher build() {
      return new WebhookDispatcher(this);
    }
  }
}
