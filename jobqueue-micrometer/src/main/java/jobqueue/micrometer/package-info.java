/**
 * Micrometer bridge for exporting job queue metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link jobqueue.micrometer.MicrometerMetricsExporter} implements the
 * {@link jobqueue.spi.MetricsExporter} SPI using Micrometer counters, a gauge and a
 * distribution summary.
 *
 * @see jobqueue.micrometer.MicrometerMetricsExporter
 */
package jobqueue.micrometer;
