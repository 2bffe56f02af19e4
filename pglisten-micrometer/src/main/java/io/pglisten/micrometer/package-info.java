/**
 * Micrometer bridge for exporting listener metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.pglisten.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.pglisten.spi.MetricsExporter} SPI using Micrometer counters, timers and gauges.
 *
 * @see io.pglisten.micrometer.MicrometerMetricsExporter
 */
package io.pglisten.micrometer;
