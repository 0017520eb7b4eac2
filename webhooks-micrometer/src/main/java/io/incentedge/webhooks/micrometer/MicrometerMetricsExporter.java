package io.incentedge.webhooks.micrometer;

import io.incentedge.webhooks.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code webhooks.records.created}: delivery records created by dispatch</li>
 *   <li>{@code webhooks.filtered}: subscriptions skipped by their filters</li>
 *   <li>{@code webhooks.delivery.success}: attempts that delivered</li>
 *   <li>{@code webhooks.delivery.retry}: failed attempts scheduled for retry</li>
 *   <li>{@code webhooks.delivery.exhausted}: records moved to exhausted</li>
 *   <li>{@code webhooks.retry.claimed}: records claimed by the retry scheduler</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code webhooks.delivery.latency.last.ms}: round-trip time of the latest attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "webhooks";

  private final MeterRegistry registry;
  private final Counter recordsCreated;
  private final Counter filtered;
  private final Counter deliverySuccess;
  private final Counter deliveryRetry;
  private final Counter deliveryExhausted;
  private final Counter retryClaimed;
  private final Gauge latencyGauge;

  private final AtomicLong lastLatencyMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "webhooks"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.webhooks"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.recordsCreated = Counter.builder(namePrefix + ".records.created")
        .description("Delivery records created by dispatch")
        .register(registry);
    this.filtered = Counter.builder(namePrefix + ".filtered")
        .description("Subscriptions skipped because their filters did not match")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Delivery attempts answered with a 2xx status")
        .register(registry);
    this.deliveryRetry = Counter.builder(namePrefix + ".delivery.retry")
        .description("Failed attempts scheduled for retry")
        .register(registry);
    this.deliveryExhausted = Counter.builder(namePrefix + ".delivery.exhausted")
        .description("Deliveries that used up their attempt budget")
        .register(registry);
    this.retryClaimed = Counter.builder(namePrefix + ".retry.claimed")
        .description("Records claimed by the retry scheduler")
        .register(registry);

    this.latencyGauge = Gauge.builder(namePrefix + ".delivery.latency.last.ms", lastLatencyMs, AtomicLong::get)
        .description("Round-trip time of the latest delivery attempt")
        .baseUnit("milliseconds")
        .register(registry);
  }

  @Override
  public void incrementRecordsCreated() {
    if (closed) return;
    recordsCreated.increment();
  }

  @Override
  public void incrementFiltered() {
    if (closed) return;
    filtered.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryRetry() {
    if (closed) return;
    deliveryRetry.increment();
  }

  @Override
  public void incrementDeliveryExhausted() {
    if (closed) return;
    deliveryExhausted.increment();
  }

  @Override
  public void recordRetryClaimed(int count) {
    if (closed || count <= 0) return;
    retryClaimed.increment(count);
  }

  @Override
  public void recordDeliveryLatencyMs(long latencyMs) {
    if (closed) return;
    lastLatencyMs.set(latencyMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.incentedge.webhooks.Webhooks#close()} calls this for an exporter it was built with.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(recordsCreated, filtered, deliverySuccess,
        deliveryRetry, deliveryExhausted, retryClaimed, latencyGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
