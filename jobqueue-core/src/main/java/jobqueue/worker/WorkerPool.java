package jobqueue.worker;

import jobqueue.JobCancelledException;
import jobqueue.StateConflictException;
import jobqueue.UnhandledJobTypeException;
import jobqueue.claim.ClaimProtocol;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.model.RunInfo;
import jobqueue.recurrence.RecurrenceEngine;
import jobqueue.retry.ExponentialBackoffRetryPolicy;
import jobqueue.retry.RetryDecision;
import jobqueue.retry.RetryPolicy;
import jobqueue.spi.MetricsExporter;
import jobqueue.spi.StoreException;
import jobqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool that claims ready jobs and runs them through their handlers.
 *
 * <p>Concurrency is counted in job <em>weight</em>: a job holds {@code weight} of the pool's
 * {@code maxConcurrency} slots while it runs, and only jobs that fit in the free slots are
 * claimed. A single claimer thread claims while slots are free and otherwise waits up to
 * {@code pollInterval} (or until a job finishes). Handlers run on a fixed pool of worker
 * threads; a scheduler refreshes the heartbeat of every running job each
 * {@code heartbeatInterval} and picks up cancel requests raised by other processes.
 *
 * <p>Outcome handling per attempt:
 * <ul>
 *   <li>No handler registered: {@code FAILED} with an {@link UnhandledJobTypeException} message,
 *       no retry.
 *   <li>Handler returns: {@code SUCCEEDED}; a recurring occurrence schedules its successor.
 *   <li>Handler throws {@link JobCancelledException}: {@code FAILED}, no retry.
 *   <li>Handler throws anything else: the {@link RetryPolicy} reschedules or fails the job.
 * </ul>
 *
 * <p>A non-transient {@link StoreException} halts claiming ({@link #isHalted()}); jobs already
 * running finish normally and committed state is left untouched.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; {@link #start()} and
 * {@link #close()} are synchronized.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final JobLedger ledger;
  private final ClaimProtocol claimProtocol;
  private final JobHandlerRegistry registry;
  private final RetryPolicy retryPolicy;
  private final RecurrenceEngine recurrenceEngine;
  private final MetricsExporter metrics;
  private final int maxConcurrency;
  private final long pollIntervalMs;
  private final long heartbeatIntervalMs;
  private final long drainTimeoutMs;
  private final Set<String> jobTypes;

  private final Semaphore slots;
  private final Semaphore wakeUp = new Semaphore(0);
  private final Map<Long, RunningJob> running = new ConcurrentHashMap<>();
  private final AtomicLong startedCount = new AtomicLong();
  private final AtomicLong finishedCount = new AtomicLong();
  private final AtomicBoolean halted = new AtomicBoolean();

  private ExecutorService claimer;
  private ExecutorService workers;
  private ScheduledExecutorService heartbeats;
  private volatile boolean started;
  private volatile boolean closed;

  private WorkerPool(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.claimProtocol = builder.claimProtocol != null
        ? builder.claimProtocol : ClaimProtocol.builder().ledger(ledger).build();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(Duration.ofSeconds(20), Duration.ofHours(1),
            ExponentialBackoffRetryPolicy.DEFAULT_JITTER);
    this.recurrenceEngine = builder.recurrenceEngine;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    requirePositive(builder.pollInterval, "pollInterval");
    requirePositive(builder.heartbeatInterval, "heartbeatInterval");
    if (builder.drainTimeout == null || builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.maxConcurrency = builder.maxConcurrency;
    this.pollIntervalMs = builder.pollInterval.toMillis();
    this.heartbeatIntervalMs = builder.heartbeatInterval.toMillis();
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    this.jobTypes = Set.copyOf(builder.jobTypes);
    this.slots = new Semaphore(maxConcurrency);
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero() || value.toMillis() == 0) {
      throw new IllegalArgumentException(name + " must be at least 1ms");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the claimer, the worker threads and the heartbeat refresher.
   * Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the pool has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WorkerPool has been closed");
    }
    if (started) {
      return;
    }
    workers = Executors.newFixedThreadPool(maxConcurrency, new DaemonThreadFactory("jobqueue-worker-"));
    heartbeats = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("jobqueue-heartbeat-"));
    heartbeats.scheduleWithFixedDelay(this::refreshHeartbeats,
        heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    claimer = Executors.newSingleThreadExecutor(new DaemonThreadFactory("jobqueue-claimer-"));
    claimer.submit(this::claimLoop);
    started = true;
    logger.log(Level.INFO, "Worker pool started: maxConcurrency={0}, jobTypes={1}",
        new Object[]{maxConcurrency, jobTypes.isEmpty() ? "*" : jobTypes});
  }

  private void claimLoop() {
    while (!closed && !halted.get() && !Thread.currentThread().isInterrupted()) {
      try {
        if (dispatchAvailable() == 0) {
          wakeUp.tryAcquire(pollIntervalMs, TimeUnit.MILLISECONDS);
          wakeUp.drainPermits();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (StoreException e) {
        onStoreFailure("claim", e);
        pause();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Claim loop error", t);
        pause();
      }
    }
  }

  private void pause() {
    try {
      Thread.sleep(pollIntervalMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Claims jobs while free slots remain and hands each one to a worker thread.
   *
   * @return the number of jobs dispatched
   * @throws IllegalStateException if the pool has not been started
   */
  public int dispatchAvailable() {
    if (!started) {
      throw new IllegalStateException("WorkerPool has not been started");
    }
    int dispatched = 0;
    while (!closed && !halted.get()) {
      Optional<Job> claimed = claimWithinFreeSlots();
      if (claimed.isEmpty()) {
        break;
      }
      Job job = claimed.get();
      try {
        workers.execute(() -> execute(job));
      } catch (RejectedExecutionException e) {
        // Shutting down: the claim stays RUNNING until a recovery sweep returns it
        slots.release(job.weight());
        logger.log(Level.WARNING, "Worker pool closing; job {0} left for recovery", job.id());
        break;
      }
      dispatched++;
    }
    return dispatched;
  }

  /**
   * Claims one job and runs it on the calling thread.
   *
   * <p>Useful for embedding the queue in a host-driven loop and for deterministic tests.
   *
   * @return {@code true} if a job was claimed and run
   */
  public boolean runNext() {
    if (closed || halted.get()) {
      return false;
    }
    Optional<Job> claimed = claimWithinFreeSlots();
    claimed.ifPresent(this::execute);
    return claimed.isPresent();
  }

  private Optional<Job> claimWithinFreeSlots() {
    // Every free slot stays reserved while the claim is in flight; the unused ones go back after
    int reserved = slots.drainPermits();
    if (reserved <= 0) {
      return Optional.empty();
    }
    Optional<Job> claimed = Optional.empty();
    try {
      claimed = claimProtocol.claim(jobTypes, reserved);
    } catch (StoreException e) {
      onStoreFailure("claim", e);
    } finally {
      slots.release(reserved - claimed.map(Job::weight).orElse(0));
    }
    if (claimed.isPresent()) {
      metrics.incrementClaimed();
    }
    return claimed;
  }

  private void execute(Job job) {
    RunningJob current = new RunningJob(job);
    running.put(job.id(), current);
    startedCount.incrementAndGet();
    metrics.recordRunning(running.size());
    try {
      runAttempt(job, current);
    } catch (StoreException e) {
      onStoreFailure("record outcome of job " + job.id(), e);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Worker error for job " + job.id(), t);
    } finally {
      running.remove(job.id());
      slots.release(job.weight());
      finishedCount.incrementAndGet();
      metrics.recordRunning(running.size());
      wakeUp.release();
    }
  }

  private void runAttempt(Job job, RunningJob current) {
    int handlerAttempt = handlerAttempt(job);
    if (handlerAttempt > job.maxRetries() + 1) {
      logger.log(Level.SEVERE, "Job {0} claimed for handler attempt {1} beyond maxRetries={2}; failing",
          new Object[]{job.id(), handlerAttempt, job.maxRetries()});
      fail(job, "RetriesExhausted: attempt " + handlerAttempt + " exceeds maxRetries=" + job.maxRetries());
      return;
    }
    JobHandler handler = registry.handlerFor(job.jobType());
    if (handler == null) {
      UnhandledJobTypeException unhandled = new UnhandledJobTypeException(job.jobType());
      logger.log(Level.SEVERE, "No handler for job {0} (type={1}); failing without retry",
          new Object[]{job.id(), job.jobType()});
      fail(job, unhandled.getMessage());
      return;
    }
    long startNanos = System.nanoTime();
    Exception failure = null;
    try {
      handler.handle(new AttemptContext(ledger, job, current.cancelRequested));
    } catch (Exception e) {
      failure = e;
    }
    metrics.recordHandlerDurationMs(
        Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
    if (failure == null) {
      succeed(job);
    } else if (failure instanceof JobCancelledException) {
      logger.log(Level.INFO, "Job {0} acknowledged cancellation", job.id());
      fail(job, describe(failure));
    } else {
      retryOrFail(job, handlerAttempt, failure);
    }
  }

  /**
   * The attempt number counted against {@code maxRetries}. Claims that were later returned by
   * the recovery sweep ended with the process, not the handler, and are not counted.
   */
  private int handlerAttempt(Job job) {
    if (job.attempt() <= 1) {
      return job.attempt();
    }
    long orphaned = ledger.runs(job.id()).stream()
        .filter(RunInfo::orphaned)
        .count();
    return job.attempt() - (int) orphaned;
  }

  private void succeed(Job job) {
    Optional<Job> done = record(job, JobTransition.succeed(job.attempt()));
    if (done.isEmpty()) {
      return;
    }
    metrics.incrementSucceeded();
    logger.log(Level.FINE, "Job {0} succeeded on attempt {1}", new Object[]{job.id(), job.attempt()});
    advanceRecurrence(done.get());
  }

  private void retryOrFail(Job job, int handlerAttempt, Exception failure) {
    RetryDecision decision = retryPolicy.decide(handlerAttempt, job.maxRetries());
    if (decision instanceof RetryDecision.Retry retry) {
      Instant runAt = ledger.now().plus(retry.delay());
      if (record(job, JobTransition.retry(job.attempt(), runAt, describe(failure))).isPresent()) {
        metrics.incrementRetried();
        logger.log(Level.WARNING, "Job " + job.id() + " attempt " + job.attempt()
            + " failed; retrying at " + runAt, failure);
      }
    } else {
      logger.log(Level.SEVERE, "Job " + job.id() + " failed after " + handlerAttempt
          + " attempts (maxRetries=" + job.maxRetries() + ")", failure);
      fail(job, describe(failure));
    }
  }

  private void fail(Job job, String error) {
    Optional<Job> failed = record(job, JobTransition.fail(job.attempt(), error));
    if (failed.isEmpty()) {
      return;
    }
    metrics.incrementFailed();
    advanceRecurrence(failed.get());
  }

  private Optional<Job> record(Job job, JobTransition transition) {
    try {
      return Optional.of(ledger.transition(job.id(), JobState.RUNNING, transition));
    } catch (StateConflictException e) {
      // Recovered and re-claimed elsewhere after a missed heartbeat; that attempt owns it now
      logger.log(Level.WARNING, "Job {0} attempt {1} lost ownership before recording {2}",
          new Object[]{job.id(), job.attempt(), transition.target()});
      return Optional.empty();
    }
  }

  private void advanceRecurrence(Job finished) {
    if (recurrenceEngine == null || !finished.isRecurring()) {
      return;
    }
    try {
      recurrenceEngine.onOccurrenceFinished(finished);
    } catch (StoreException e) {
      throw e;
    } catch (RuntimeException e) {
      // The startup reconcile repairs a schedule left behind here
      logger.log(Level.SEVERE, "Failed to schedule next occurrence of " + finished.recurringRef(), e);
    }
  }

  private static String describe(Throwable failure) {
    String message = failure.getMessage();
    String type = failure.getClass().getSimpleName();
    return message == null ? type : type + ": " + message;
  }

  private void onStoreFailure(String action, StoreException e) {
    if (e.isTransient()) {
      logger.log(Level.WARNING, "Transient store failure during " + action, e);
      return;
    }
    if (halted.compareAndSet(false, true)) {
      logger.log(Level.SEVERE, "Fatal store failure during " + action + "; worker pool stops claiming", e);
    }
  }

  /**
   * Refreshes the heartbeat of every job running in this pool and picks up cancel flags set by
   * other processes. Called by the scheduler; may also be invoked directly.
   */
  public void refreshHeartbeats() {
    for (RunningJob current : running.values()) {
      Job job = current.job;
      try {
        if (!ledger.heartbeat(job.id(), job.attempt())) {
          logger.log(Level.WARNING, "Heartbeat rejected for job {0} attempt {1}",
              new Object[]{job.id(), job.attempt()});
          continue;
        }
        if (!current.cancelRequested.get()) {
          ledger.findJob(job.id())
              .filter(Job::cancelRequested)
              .ifPresent(j -> current.cancelRequested.set(true));
        }
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Heartbeat failed for job " + job.id(), t);
      }
    }
  }

  /**
   * Raises the cooperative cancel flag of a job running in this pool.
   *
   * @param jobId the job id
   * @return {@code true} if the job is running here
   */
  public boolean requestCancel(long jobId) {
    RunningJob current = running.get(jobId);
    if (current == null) {
      return false;
    }
    current.cancelRequested.set(true);
    return true;
  }

  /** Nudges the claimer to look for work now instead of after the poll interval. */
  public void wakeUp() {
    wakeUp.release();
  }

  public boolean isHalted() {
    return halted.get();
  }

  public long startedCount() {
    return startedCount.get();
  }

  public long finishedCount() {
    return finishedCount.get();
  }

  public int runningCount() {
    return running.size();
  }

  /** Ids of the jobs currently executing in this pool. */
  public Collection<Long> runningJobIds() {
    return Set.copyOf(running.keySet());
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }

  /**
   * Stops claiming, waits up to the drain timeout for running handlers, then interrupts the
   * rest. Jobs interrupted this way stay {@code RUNNING} until a recovery sweep returns them.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (!started) {
      return;
    }
    wakeUp.release();
    claimer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting jobs " + running.keySet());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
      claimer.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      heartbeats.shutdownNow();
    }
    logger.log(Level.INFO, "Worker pool closed: started={0}, finished={1}",
        new Object[]{startedCount.get(), finishedCount.get()});
  }

  private static final class RunningJob {
    final Job job;
    final AtomicBoolean cancelRequested;

    RunningJob(Job job) {
      this.job = job;
      this.cancelRequested = new AtomicBoolean(job.cancelRequested());
    }
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private JobLedger ledger;
    private ClaimProtocol claimProtocol;
    private JobHandlerRegistry registry;
    private RetryPolicy retryPolicy;
    private RecurrenceEngine recurrenceEngine;
    private MetricsExporter metrics;
    private int maxConcurrency = 4;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Set<String> jobTypes = Set.of();

    private Builder() {}

    /**
     * Sets the ledger used to record attempt outcomes, checkpoints and heartbeats.
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
     * Sets the registry that maps job types to handlers.
     *
     * <p><b>Required.</b>
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(JobHandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the claim protocol.
     *
     * <p>Optional. Defaults to a {@link ClaimProtocol} over the ledger.
     *
     * @param claimProtocol the claim protocol
     * @return this builder
     */
    public Builder claimProtocol(ClaimProtocol claimProtocol) {
      this.claimProtocol = claimProtocol;
      return this;
    }

    /**
     * Sets the retry policy consulted when a handler throws.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 20s base delay,
     * a 1h cap and 20% jitter.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the engine that schedules the next occurrence when a recurring job finishes.
     *
     * <p>Optional. Without one, recurring occurrences do not advance their schedule.
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
     * Sets the total job weight that may run at once.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param maxConcurrency concurrency limit in weight units
     * @return this builder
     */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /**
     * Sets how long the claimer waits when no job is ready.
     *
     * <p>Optional. Defaults to 1 second.
     *
     * @param pollInterval idle wait between claim attempts
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets how often running jobs refresh their heartbeat. Keep it well below the recovery
     * sweep's liveness threshold.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param heartbeatInterval heartbeat period
     * @return this builder
     */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /**
     * Sets how long {@link WorkerPool#close()} waits for running handlers.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param drainTimeout maximum drain wait
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Restricts the pool to the given job types.
     *
     * <p>Optional. Defaults to all job types.
     *
     * @param jobTypes the job types this pool claims
     * @return this builder
     */
    public Builder jobTypes(Set<String> jobTypes) {
      this.jobTypes = Objects.requireNonNull(jobTypes, "jobTypes");
      return this;
    }

    /**
     * Builds the pool. Call {@link WorkerPool#start()} to begin claiming.
     *
     * @return a new {@link WorkerPool}
     * @throws NullPointerException     if a required setting is missing
     * @throws IllegalArgumentException if a limit or interval is out of range
     */
    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
