/**
 * Service Provider Interfaces (SPI) for plugging the queue into a durable store and a
 * metrics backend.
 *
 * @see jobqueue.spi.JobStore
 * @see jobqueue.spi.ConnectionProvider
 * @see jobqueue.spi.MetricsExporter
 */
package jobqueue.spi;
