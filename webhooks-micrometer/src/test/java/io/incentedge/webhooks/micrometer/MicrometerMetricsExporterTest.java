package io.incentedge.webhooks.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementRecordsCreated() {
    exporter.incrementRecordsCreated();
    exporter.incrementRecordsCreated();
    assertEquals(2.0, counter("webhooks.records.created").count());
  }

  @Test
  void incrementFiltered() {
    exporter.incrementFiltered();
    assertEquals(1.0, counter("webhooks.filtered").count());
  }

  @Test
  void deliveryOutcomes() {
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryRetry();
    exporter.incrementDeliveryRetry();
    exporter.incrementDeliveryExhausted();

    assertEquals(1.0, counter("webhooks.delivery.success").count());
    assertEquals(2.0, counter("webhooks.delivery.retry").count());
    assertEquals(1.0, counter("webhooks.delivery.exhausted").count());
  }

  @Test
  void retryClaimedAddsBatchSize() {
    exporter.recordRetryClaimed(5);
    exporter.recordRetryClaimed(0);
    exporter.recordRetryClaimed(3);
    assertEquals(8.0, counter("webhooks.retry.claimed").count());
  }

  @Test
  void recordDeliveryLatency() {
    exporter.recordDeliveryLatencyMs(250L);
    assertEquals(250.0, gauge("webhooks.delivery.latency.last.ms").value());

    exporter.recordDeliveryLatencyMs(12L);
    assertEquals(12.0, gauge("webhooks.delivery.latency.last.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "billing.webhooks");
    custom.incrementDeliverySuccess();
    custom.recordDeliveryLatencyMs(40L);

    assertEquals(1.0, counter("billing.webhooks.delivery.success").count());
    assertEquals(40.0, gauge("billing.webhooks.delivery.latency.last.ms").value());
    assertEquals(0.0, counter("webhooks.delivery.success").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementDeliverySuccess();
    exporter.close();

    assertNull(registry.find("webhooks.delivery.success").counter());
    assertNull(registry.find("webhooks.delivery.latency.last.ms").gauge());
    assertTrue(registry.getMeters().isEmpty());

    exporter.incrementDeliverySuccess();
    exporter.recordRetryClaimed(4);
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "webhooks."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
