/**
 * Micrometer bridge for exporting webhook delivery metrics.
 *
 * <p>{@link io.incentedge.webhooks.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.incentedge.webhooks.spi.MetricsExporter} SPI using Micrometer counters and a gauge.
 */
package io.incentedge.webhooks.micrometer;
