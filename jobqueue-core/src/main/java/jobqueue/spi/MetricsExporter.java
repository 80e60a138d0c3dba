package jobqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of jobs written by enqueue calls.
   */
  void incrementEnqueued();

  /**
   * Increments the count of successful claims.
   */
  void incrementClaimed();

  /**
   * Increments the count of jobs whose handler completed successfully.
   */
  void incrementSucceeded();

  /**
   * Increments the count of failed attempts that were rescheduled.
   */
  void incrementRetried();

  /**
   * Increments the count of jobs moved to FAILED (retries exhausted or no handler).
   */
  void incrementFailed();

  /**
   * Increments the count of pending jobs cancelled by callers.
   */
  default void incrementCancelled() {
  }

  /**
   * Increments the count of orphaned jobs returned to PENDING by the recovery sweep.
   */
  default void incrementRecovered() {
  }

  /**
   * Increments the count of occurrences materialized from recurring schedules.
   */
  default void incrementRecurrenceEnqueued() {
  }

  /**
   * Records the number of jobs currently executing in this process.
   *
   * @param running number of in-flight handler invocations
   */
  void recordRunning(int running);

  /**
   * Records the time spent in the handler for one attempt.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void incrementClaimed() {
    }

    @Override
    public void incrementSucceeded() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordRunning(int running) {
    }
  }
}
