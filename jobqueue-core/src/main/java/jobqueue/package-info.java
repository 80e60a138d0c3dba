/**
 * Embeddable, durably persisted job queue.
 *
 * <p>{@link jobqueue.JobQueue} is the entry point: enqueue jobs with priority, delay and a retry
 * budget, register recurring schedules, and run handlers on a bounded worker pool with retry,
 * checkpointing and crash recovery. Persistence goes through the {@link jobqueue.spi.JobStore}
 * SPI; JDBC implementations live in the {@code jobqueue-jdbc} module.
 */
package jobqueue;
