package jobqueue.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import jobqueue.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a gauge and a distribution summary with a {@link MeterRegistry} for
 * export to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.enqueued}: jobs written by enqueue calls</li>
 *   <li>{@code jobqueue.jobs.claimed}: attempts started</li>
 *   <li>{@code jobqueue.jobs.succeeded}: jobs completed successfully</li>
 *   <li>{@code jobqueue.jobs.retried}: failed attempts rescheduled</li>
 *   <li>{@code jobqueue.jobs.failed}: jobs moved to FAILED</li>
 *   <li>{@code jobqueue.jobs.cancelled}: pending jobs cancelled</li>
 *   <li>{@code jobqueue.jobs.recovered}: orphaned jobs returned to PENDING</li>
 *   <li>{@code jobqueue.recurrence.enqueued}: occurrences created from schedules</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code jobqueue.jobs.running}: handler invocations in flight in this process</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code jobqueue.handler.duration}: handler execution time per attempt, in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter succeeded;
  private final Counter retried;
  private final Counter failed;
  private final Counter cancelled;
  private final Counter recovered;
  private final Counter recurrenceEnqueued;
  private final Gauge runningGauge;
  private final DistributionSummary handlerDuration;

  private final AtomicInteger running = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobqueue"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobqueue");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.jobqueue"})
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
    this.enqueued = counter(namePrefix + ".jobs.enqueued", "Jobs written by enqueue calls");
    this.claimed = counter(namePrefix + ".jobs.claimed", "Attempts started");
    this.succeeded = counter(namePrefix + ".jobs.succeeded", "Jobs completed successfully");
    this.retried = counter(namePrefix + ".jobs.retried", "Failed attempts rescheduled");
    this.failed = counter(namePrefix + ".jobs.failed", "Jobs moved to FAILED");
    this.cancelled = counter(namePrefix + ".jobs.cancelled", "Pending jobs cancelled");
    this.recovered = counter(namePrefix + ".jobs.recovered", "Orphaned jobs returned to PENDING");
    this.recurrenceEnqueued = counter(namePrefix + ".recurrence.enqueued",
        "Occurrences created from recurring schedules");

    this.runningGauge = Gauge.builder(namePrefix + ".jobs.running", running, AtomicInteger::get)
        .description("Handler invocations in flight")
        .register(registry);
    this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration")
        .description("Handler execution time per attempt")
        .baseUnit("milliseconds")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementSucceeded() {
    if (closed) return;
    succeeded.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementCancelled() {
    if (closed) return;
    cancelled.increment();
  }

  @Override
  public void incrementRecovered() {
    if (closed) return;
    recovered.increment();
  }

  @Override
  public void incrementRecurrenceEnqueued() {
    if (closed) return;
    recurrenceEnqueued.increment();
  }

  @Override
  public void recordRunning(int running) {
    if (closed) return;
    this.running.set(running);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link jobqueue.JobQueue#close()} calls this, which keeps a closed queue from
   * leaving stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, claimed, succeeded, retried, failed, cancelled,
        recovered, recurrenceEnqueued, runningGauge, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
