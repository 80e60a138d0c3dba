package jobqueue.recovery;

import jobqueue.StateConflictException;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.recurrence.RecurrenceEngine;
import jobqueue.spi.MetricsExporter;
import jobqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Returns jobs orphaned by a crashed or killed worker to the queue.
 *
 * <p>A {@code RUNNING} job whose heartbeat is older than the liveness threshold is moved back to
 * {@code PENDING} with {@code run_at = now} and its attempt counter unchanged. Each job is
 * recovered in its own transaction, guarded on the attempt and on the heartbeat still being
 * stale, so a sweep that dies half way leaves nothing stuck and never steals a job whose worker
 * is alive. After the jobs, recurring schedules are reconciled.
 *
 * <p>The queue runs one sweep at startup, before any claim. With an interval configured the
 * sweep also repeats in the background, which recovers jobs of other processes that died while
 * this one keeps running.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RecoverySweep implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RecoverySweep.class.getName());

  private final JobLedger ledger;
  private final RecurrenceEngine recurrenceEngine;
  private final MetricsExporter metrics;
  private final Duration livenessThreshold;
  private final int batchSize;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private RecoverySweep(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.recurrenceEngine = builder.recurrenceEngine;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.livenessThreshold == null || builder.livenessThreshold.isNegative()
        || builder.livenessThreshold.isZero()) {
      throw new IllegalArgumentException("livenessThreshold must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval != null && builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be >= 0");
    }
    this.livenessThreshold = builder.livenessThreshold;
    this.batchSize = builder.batchSize;
    this.interval = builder.interval != null ? builder.interval : Duration.ZERO;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts periodic sweeps if an interval was configured; otherwise does nothing.
   * Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RecoverySweep has been closed");
    }
    if (sweepTask != null || interval.isZero()) {
      return;
    }
    long intervalMs = interval.toMillis();
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-recovery-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single sweep: recovers stale jobs batch by batch, then reconciles recurring
   * schedules. Failures are logged; called by the scheduler and at queue startup.
   *
   * @return the number of jobs returned to {@code PENDING}
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    int recovered = 0;
    try {
      recovered = recoverStaleJobs();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Recovery sweep failed", t);
    }
    if (recurrenceEngine != null) {
      try {
        recurrenceEngine.reconcile();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Recurring schedule reconciliation failed", t);
      }
    }
    return recovered;
  }

  private int recoverStaleJobs() {
    int total = 0;
    List<Job> batch;
    do {
      Instant now = ledger.now();
      Instant cutoff = now.minus(livenessThreshold);
      batch = ledger.findStaleRunning(cutoff, batchSize);
      int recovered = 0;
      for (Job job : batch) {
        if (recover(job, now, cutoff)) {
          recovered++;
        }
      }
      total += recovered;
      if (recovered == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    if (total > 0) {
      logger.log(Level.INFO, "Recovered {0} orphaned job(s) with heartbeats older than {1}",
          new Object[]{total, livenessThreshold});
    }
    return total;
  }

  private boolean recover(Job job, Instant now, Instant cutoff) {
    try {
      ledger.transition(job.id(), JobState.RUNNING, JobTransition.recover(job.attempt(), now, cutoff));
      metrics.incrementRecovered();
      logger.log(Level.WARNING, "Recovered orphaned job {0} (type={1}, attempt={2}, heartbeat={3})",
          new Object[]{job.id(), job.jobType(), job.attempt(), job.heartbeatAt()});
      return true;
    } catch (StateConflictException e) {
      // Finished or heartbeated between the scan and the update
      logger.log(Level.FINE, "Job {0} no longer orphaned", job.id());
      return false;
    }
  }

  /** Cancels the periodic sweep and shuts down its thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RecoverySweep}. */
  public static final class Builder {
    private JobLedger ledger;
    private RecurrenceEngine recurrenceEngine;
    private MetricsExporter metrics;
    private Duration livenessThreshold = Duration.ofMinutes(2);
    private int batchSize = 100;
    private Duration interval;

    private Builder() {}

    /**
     * Sets the ledger to sweep.
     *
     * <p><b>Required.</b>
     *
     * @param ledger the job ledger
     * @return this builder
     */
    public Builder ledger(JobLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Sets the engine whose schedules are reconciled after each sweep.
     *
     * <p>Optional. Without one, schedules are not reconciled.
     *
     * @param recurrenceEngine the recurrence engine
     * @return this builder
     */
    public Builder recurrenceEngine(RecurrenceEngine recurrenceEngine) {
      this.recurrenceEngine = recurrenceEngine;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how old a heartbeat must be before its job counts as orphaned. Must comfortably
     * exceed the worker heartbeat interval.
     *
     * <p>Optional. Defaults to 2 minutes.
     *
     * @param livenessThreshold maximum heartbeat age of a live job
     * @return this builder
     */
    public Builder livenessThreshold(Duration livenessThreshold) {
      this.livenessThreshold = livenessThreshold;
      return this;
    }

    /**
     * Sets how many stale jobs are read per batch.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param batchSize rows per batch
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the period of background sweeps.
     *
     * <p>Optional. Defaults to zero: sweep only when {@link RecoverySweep#runOnce()} is called.
     *
     * @param interval sweep period, or zero to disable
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Builds the sweep.
     *
     * @return a new {@link RecoverySweep}
     * @throws NullPointerException     if {@code ledger} is null
     * @throws IllegalArgumentException if a threshold, batch size or interval is out of range
     */
    public RecoverySweep build() {
      return new RecoverySweep(this);
    }
  }
}
