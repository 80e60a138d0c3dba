package jobqueue;

import jobqueue.failed.FailedJobManager;
import jobqueue.ledger.JobLedger;
import jobqueue.model.JobState;
import jobqueue.model.JobStatus;
import jobqueue.model.RecurringSchedule;
import jobqueue.recovery.RecoverySweep;
import jobqueue.recurrence.CadenceEvaluator;
import jobqueue.recurrence.CompositeCadenceEvaluator;
import jobqueue.recurrence.RecurrenceEngine;
import jobqueue.recurrence.RecurringJob;
import jobqueue.retry.ExponentialBackoffRetryPolicy;
import jobqueue.retry.RetryPolicy;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.MetricsExporter;
import jobqueue.worker.DefaultJobHandlerRegistry;
import jobqueue.worker.JobHandler;
import jobqueue.worker.JobHandlerRegistry;
import jobqueue.worker.WorkerPool;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that wires the ledger, worker pool, recovery sweep and recurrence engine into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (JobQueue queue = JobQueue.builder()
 *     .connectionProvider(connectionProvider)
 *     .store(JdbcJobStores.detect(dataSource))
 *     .handler("send-email", ctx -> mailer.send(ctx.payload()))
 *     .maxConcurrency(8)
 *     .build()) {
 *   queue.start();
 *   long id = queue.enqueue(NewJob.builder("send-email").payload(bytes).build());
 * }
 * }</pre>
 *
 * <p>{@link #start()} first runs the recovery sweep (orphaned jobs and recurring schedules) and
 * only then lets the worker pool claim. Enqueue, status, cancel and modify work whether or not
 * the queue has been started, so a process can act as a pure producer.
 *
 * @see WorkerPool
 * @see RecoverySweep
 * @see RecurrenceEngine
 */
public final class JobQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  private final JobLedger ledger;
  private final WorkerPool workerPool;
  private final RecoverySweep recoverySweep;
  private final RecurrenceEngine recurrenceEngine;
  private final FailedJobManager failedJobs;
  private final MetricsExporter metrics;
  private final int maxConcurrency;

  private boolean started;
  private boolean closed;

  private JobQueue(Builder builder) {
    Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    Objects.requireNonNull(builder.store, "store");
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.ledger = new JobLedger(builder.connectionProvider, builder.store,
        builder.clock != null ? builder.clock : Clock.systemUTC(), builder.defaultMaxRetries);
    this.recurrenceEngine = new RecurrenceEngine(ledger,
        builder.cadenceEvaluator != null ? builder.cadenceEvaluator : new CompositeCadenceEvaluator(),
        metrics);
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(builder.retryBaseDelay, builder.retryMaxDelay, builder.retryJitter);
    this.workerPool = WorkerPool.builder()
        .ledger(ledger)
        .registry(builder.registry)
        .retryPolicy(retryPolicy)
        .recurrenceEngine(recurrenceEngine)
        .metrics(metrics)
        .maxConcurrency(builder.maxConcurrency)
        .pollInterval(builder.pollInterval)
        .heartbeatInterval(builder.heartbeatInterval)
        .drainTimeout(builder.drainTimeout)
        .jobTypes(builder.jobTypes)
        .build();
    this.recoverySweep = RecoverySweep.builder()
        .ledger(ledger)
        .recurrenceEngine(recurrenceEngine)
        .metrics(metrics)
        .livenessThreshold(builder.livenessThreshold)
        .interval(builder.recoveryInterval)
        .build();
    this.failedJobs = new FailedJobManager(ledger);
    this.maxConcurrency = builder.maxConcurrency;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the recovery sweep, then starts the worker pool and the optional periodic sweep.
   * Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the queue has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobQueue has been closed");
    }
    if (started) {
      return;
    }
    recoverySweep.runOnce();
    recoverySweep.start();
    workerPool.start();
    started = true;
  }

  /**
   * Enqueues a job.
   *
   * @param job the enqueue request
   * @return the new job id
   * @throws JobValidationException if the job's weight exceeds the pool's concurrency, or it
   *                                references an unknown recurring schedule
   */
  public long enqueue(NewJob job) {
    Objects.requireNonNull(job, "job");
    checkWeight(job.weight());
    long id = ledger.insertJob(job);
    metrics.incrementEnqueued();
    logger.log(Level.FINE, "Enqueued job {0} (type={1})", new Object[]{id, job.jobType()});
    workerPool.wakeUp();
    return id;
  }

  /**
   * Enqueues a job with default priority, run time and retry budget.
   *
   * @param jobType the job type
   * @param payload opaque payload, may be {@code null}
   * @return the new job id
   * @throws JobValidationException if {@code jobType} is empty
   */
  public long enqueue(String jobType, byte[] payload) {
    return enqueue(NewJob.builder(jobType).payload(payload).build());
  }

  /**
   * Enqueues several jobs atomically: all are written or none.
   *
   * @param jobs the enqueue requests
   * @return the new ids, in request order
   */
  public List<Long> enqueueAll(List<NewJob> jobs) {
    Objects.requireNonNull(jobs, "jobs");
    for (NewJob job : jobs) {
      checkWeight(Objects.requireNonNull(job, "job").weight());
    }
    List<Long> ids = ledger.insertJobs(jobs);
    for (int i = 0; i < ids.size(); i++) {
      metrics.incrementEnqueued();
    }
    workerPool.wakeUp();
    return ids;
  }

  /**
   * Returns a job's current state, attempt count, checkpoint, run time and run history.
   *
   * @throws JobNotFoundException if no job has this id
   */
  public JobStatus getStatus(long jobId) {
    return ledger.status(jobId);
  }

  /**
   * Cancels a pending job. A running job cannot be cancelled; it is flagged instead, and a
   * handler that checks {@link jobqueue.worker.JobContext#isCancelRequested()} may stop early.
   *
   * @param jobId the job id
   * @return {@link OperationResult.Ok}, or a conflict carrying the job's actual state
   * @throws JobNotFoundException if no job has this id
   */
  public OperationResult cancel(long jobId) {
    try {
      ledger.cancelIfPending(jobId);
      metrics.incrementCancelled();
      logger.log(Level.FINE, "Cancelled job {0}", jobId);
      return OperationResult.ok();
    } catch (StateConflictException e) {
      if (e.actual() == JobState.RUNNING) {
        ledger.requestCancel(jobId);
        workerPool.requestCancel(jobId);
        logger.log(Level.FINE, "Job {0} is running; cancel requested", jobId);
      }
      return OperationResult.conflict(e);
    }
  }

  /**
   * Changes fields of a pending job.
   *
   * @param jobId  the job id
   * @param update the fields to change
   * @return {@link OperationResult.Ok}, or a conflict carrying the job's actual state
   * @throws JobNotFoundException   if no job has this id
   * @throws JobValidationException if the new weight exceeds the pool's concurrency
   */
  public OperationResult modify(long jobId, JobUpdate update) {
    Objects.requireNonNull(update, "update");
    if (update.weight() != null) {
      checkWeight(update.weight());
    }
    try {
      ledger.modifyIfPending(jobId, update);
      workerPool.wakeUp();
      return OperationResult.ok();
    } catch (StateConflictException e) {
      return OperationResult.conflict(e);
    }
  }

  /**
   * Registers a recurring schedule and its first occurrence. Registering an existing schedule id
   * again is a no-op.
   *
   * @param request the schedule definition
   * @return the schedule id
   * @throws JobValidationException if the cadence is invalid or the weight exceeds the pool's
   *                                concurrency
   */
  public String registerRecurring(RecurringJob request) {
    Objects.requireNonNull(request, "request");
    checkWeight(request.weight());
    String scheduleId = recurrenceEngine.register(request);
    workerPool.wakeUp();
    return scheduleId;
  }

  /**
   * Reads a recurring schedule.
   *
   * @throws JobNotFoundException if no schedule has this id
   */
  public RecurringSchedule schedule(String scheduleId) {
    return ledger.readSchedule(scheduleId);
  }

  public FailedJobManager failedJobs() {
    return failedJobs;
  }

  public WorkerPool workerPool() {
    return workerPool;
  }

  public RecoverySweep recoverySweep() {
    return recoverySweep;
  }

  public JobLedger ledger() {
    return ledger;
  }

  private void checkWeight(int weight) {
    if (weight > maxConcurrency) {
      throw new JobValidationException("weight " + weight + " exceeds maxConcurrency " + maxConcurrency);
    }
  }

  /**
   * Shuts down components in order: periodic recovery, worker pool (draining running jobs),
   * then the metrics exporter if it is closeable.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException first = null;
    try {
      recoverySweep.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      workerPool.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link JobQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore store;
    private Clock clock;
    private JobHandlerRegistry registry = new DefaultJobHandlerRegistry();
    private CadenceEvaluator cadenceEvaluator;
    private RetryPolicy retryPolicy;
    private Duration retryBaseDelay = Duration.ofSeconds(20);
    private Duration retryMaxDelay = Duration.ofHours(1);
    private double retryJitter = ExponentialBackoffRetryPolicy.DEFAULT_JITTER;
    private int defaultMaxRetries = JobLedger.DEFAULT_MAX_RETRIES;
    private int maxConcurrency = 4;
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration drainTimeout = Duration.ofSeconds(30);
    private Duration livenessThreshold = Duration.ofMinutes(2);
    private Duration recoveryInterval = Duration.ZERO;
    private MetricsExporter metrics;
    private Set<String> jobTypes = Set.of();

    private Builder() {}

    /**
     * Sets the connection provider for all store access.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store adapter.
     *
     * <p><b>Required.</b>
     */
    public Builder store(JobStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the clock used for run times, heartbeats and recurrence.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Replaces the handler registry.
     *
     * <p>Optional. Defaults to an empty {@link DefaultJobHandlerRegistry}; mutually exclusive
     * with {@link #handler(String, JobHandler)}.
     */
    public Builder registry(JobHandlerRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
      return this;
    }

    /**
     * Registers a handler in the default registry.
     *
     * @throws IllegalStateException if a custom registry was set or the type is already handled
     */
    public Builder handler(String jobType, JobHandler handler) {
      if (!(registry instanceof DefaultJobHandlerRegistry defaults)) {
        throw new IllegalStateException("handler() cannot be combined with a custom registry");
      }
      defaults.register(jobType, handler);
      return this;
    }

    /**
     * Sets the cadence evaluator for recurring schedules.
     *
     * <p>Optional. Defaults to {@link CompositeCadenceEvaluator} (cron or interval).
     */
    public Builder cadenceEvaluator(CadenceEvaluator cadenceEvaluator) {
      this.cadenceEvaluator = cadenceEvaluator;
      return this;
    }

    /**
     * Sets a custom retry policy, overriding the backoff settings below.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the delay before the first retry; it doubles on each following retry.
     *
     * <p>Optional. Defaults to 20 seconds.
     */
    public Builder retryBaseDelay(Duration retryBaseDelay) {
      this.retryBaseDelay = Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
      return this;
    }

    /**
     * Sets the cap on retry delays.
     *
     * <p>Optional. Defaults to 1 hour.
     */
    public Builder retryMaxDelay(Duration retryMaxDelay) {
      this.retryMaxDelay = Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
      return this;
    }

    /**
     * Sets the random spread applied to retry delays, as a fraction in {@code [0, 1)}.
     *
     * <p>Optional. Defaults to {@code 0.2}.
     */
    public Builder retryJitter(double retryJitter) {
      this.retryJitter = retryJitter;
      return this;
    }

    /**
     * Sets the retry budget of jobs enqueued without one.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    /**
     * Sets the total weight of jobs that may run at once in this process.
     *
     * <p>Optional. Defaults to {@code 4}.
     */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /** Optional. Defaults to 1 second. */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the heartbeat age after which a running job counts as orphaned.
     *
     * <p>Optional. Defaults to 2 minutes.
     */
    public Builder livenessThreshold(Duration livenessThreshold) {
      this.livenessThreshold = livenessThreshold;
      return this;
    }

    /**
     * Sets the period of background recovery sweeps.
     *
     * <p>Optional. Defaults to zero: recover only at {@link JobQueue#start()}.
     */
    public Builder recoveryInterval(Duration recoveryInterval) {
      this.recoveryInterval = recoveryInterval;
      return this;
    }

    /**
     * Sets the metrics exporter. A closeable exporter is closed with the queue.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Restricts this process's workers to the given job types.
     *
     * <p>Optional. Defaults to all job types.
     */
    public Builder jobTypes(Set<String> jobTypes) {
      this.jobTypes = Objects.requireNonNull(jobTypes, "jobTypes");
      return this;
    }

    /**
     * Builds the queue. Call {@link JobQueue#start()} to begin processing.
     *
     * @throws NullPointerException     if a required setting is missing
     * @throws IllegalArgumentException if a setting is out of range
     */
    public JobQueue build() {
      return new JobQueue(this);
    }
  }
}
