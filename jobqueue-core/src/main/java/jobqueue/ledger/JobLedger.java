package jobqueue.ledger;

import jobqueue.JobNotFoundException;
import jobqueue.JobUpdate;
import jobqueue.JobValidationException;
import jobqueue.NewJob;
import jobqueue.StateConflictException;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobStatus;
import jobqueue.model.JobTransition;
import jobqueue.model.RecurringSchedule;
import jobqueue.model.RunInfo;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.JobStore;
import jobqueue.spi.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transactional operations over jobs, checkpoints, run history and recurring schedules.
 *
 * <p>Every public operation borrows a connection from the {@link ConnectionProvider}, runs as
 * exactly one transaction and closes the connection, so each call is all-or-nothing relative
 * to a crash. Guarded writes that lose a race raise {@link StateConflictException}; writes
 * against a missing row raise {@link JobNotFoundException}.
 *
 * <p>This class is thread-safe.
 */
public final class JobLedger {
  private static final Logger logger = Logger.getLogger(JobLedger.class.getName());

  public static final int DEFAULT_MAX_RETRIES = 3;

  private final ConnectionProvider connectionProvider;
  private final JobStore store;
  private final Clock clock;
  private final int defaultMaxRetries;

  public JobLedger(ConnectionProvider connectionProvider, JobStore store) {
    this(connectionProvider, store, Clock.systemUTC(), DEFAULT_MAX_RETRIES);
  }

  public JobLedger(ConnectionProvider connectionProvider, JobStore store, Clock clock, int defaultMaxRetries) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    this.defaultMaxRetries = defaultMaxRetries;
  }

  public JobStore store() {
    return store;
  }

  public Clock clock() {
    return clock;
  }

  public Instant now() {
    return clock.instant();
  }

  public int defaultMaxRetries() {
    return defaultMaxRetries;
  }

  // ── Jobs ───────────────────────────────────────────────────────

  /**
   * Inserts a job in {@code PENDING} state.
   *
   * @param job the enqueue request
   * @return the new job id
   * @throws JobValidationException if the request references an unknown recurring schedule
   */
  public long insertJob(NewJob job) {
    Objects.requireNonNull(job, "job");
    return inTransaction("insert job", conn -> insert(conn, job, now()));
  }

  /**
   * Inserts several jobs in one transaction: either all are written or none.
   *
   * @param jobs the enqueue requests
   * @return the new ids, in request order
   */
  public List<Long> insertJobs(List<NewJob> jobs) {
    Objects.requireNonNull(jobs, "jobs");
    if (jobs.isEmpty()) {
      return List.of();
    }
    return inTransaction("insert jobs", conn -> {
      Instant now = now();
      List<Long> ids = new ArrayList<>(jobs.size());
      for (NewJob job : jobs) {
        ids.add(insert(conn, job, now));
      }
      return ids;
    });
  }

  private long insert(Connection conn, NewJob job, Instant now) {
    if (job.recurringRef() != null && store.findSchedule(conn, job.recurringRef()).isEmpty()) {
      throw new JobValidationException("Unknown recurring schedule: " + job.recurringRef());
    }
    return store.insertJob(conn, job.resolve(now, defaultMaxRetries), now);
  }

  /**
   * Reads a job.
   *
   * @throws JobNotFoundException if no job has this id
   */
  public Job readJob(long id) {
    return findJob(id).orElseThrow(() -> JobNotFoundException.job(id));
  }

  public Optional<Job> findJob(long id) {
    return inTransaction("read job", conn -> store.findJob(conn, id));
  }

  /**
   * Reads a job together with its run history.
   *
   * @throws JobNotFoundException if no job has this id
   */
  public JobStatus status(long id) {
    return inTransaction("read job status", conn -> {
      Job job = store.findJob(conn, id).orElseThrow(() -> JobNotFoundException.job(id));
      return JobStatus.from(job, store.findRuns(conn, id));
    });
  }

  public List<RunInfo> runs(long id) {
    return inTransaction("read job runs", conn -> store.findRuns(conn, id));
  }

  /**
   * Durably overwrites the checkpoint of a running attempt. Committed before returning.
   *
   * @throws StateConflictException if the job is no longer held by {@code attempt}
   */
  public void writeCheckpoint(long id, int attempt, byte[] checkpoint) {
    inTransaction("write checkpoint", conn -> {
      int rows = store.writeCheckpoint(conn, id, attempt, checkpoint, now());
      requireApplied(conn, rows, id, JobState.RUNNING, StateConflictException.Reason.STATE_CHANGED);
      return null;
    });
  }

  /**
   * Refreshes the heartbeat of a running attempt.
   *
   * @return {@code false} if the job is no longer held by {@code attempt}
   */
  public boolean heartbeat(long id, int attempt) {
    return inTransaction("heartbeat", conn -> store.heartbeat(conn, id, attempt, now()) > 0);
  }

  /**
   * Applies a guarded state change. When leaving {@code RUNNING}, the attempt's run-history
   * entry is closed in the same transaction.
   *
   * @param id         the job id
   * @param expected   state the job must currently be in
   * @param transition the target state and field changes
   * @return the job as written
   * @throws StateConflictException   if the job is not in {@code expected} (or on another attempt)
   * @throws JobNotFoundException     if the job does not exist
   * @throws IllegalArgumentException if the state machine has no such edge
   */
  public Job transition(long id, JobState expected, JobTransition transition) {
    if (!expected.canTransitionTo(transition.target())) {
      throw new IllegalArgumentException("Illegal transition " + expected + " -> " + transition.target());
    }
    return inTransaction("transition job", conn -> {
      Instant now = now();
      int rows = store.transition(conn, id, expected, transition, now);
      requireApplied(conn, rows, id, expected, StateConflictException.Reason.STATE_CHANGED);
      Job written = store.findJob(conn, id).orElseThrow(() -> JobNotFoundException.job(id));
      if (expected == JobState.RUNNING) {
        boolean success = transition.target() == JobState.SUCCEEDED;
        store.finishRun(conn, id, written.attempt(), now, success, transition.lastError());
      }
      return written;
    });
  }

  /**
   * Cancels a job that is still pending.
   *
   * @throws StateConflictException with reason {@code NOT_PENDING} if it already left PENDING
   */
  public void cancelIfPending(long id) {
    inTransaction("cancel job", conn -> {
      int rows = store.transition(conn, id, JobState.PENDING, JobTransition.cancel(), now());
      requireApplied(conn, rows, id, JobState.PENDING, StateConflictException.Reason.NOT_PENDING);
      return null;
    });
  }

  /**
   * Modifies a job that is still pending.
   *
   * @throws StateConflictException with reason {@code NOT_PENDING} if it already left PENDING
   */
  public void modifyIfPending(long id, JobUpdate update) {
    Objects.requireNonNull(update, "update");
    inTransaction("modify job", conn -> {
      int rows = store.updateIfPending(conn, id, update, now());
      requireApplied(conn, rows, id, JobState.PENDING, StateConflictException.Reason.NOT_PENDING);
      return null;
    });
  }

  /**
   * Raises the cooperative cancel flag of a running job.
   *
   * @return {@code true} if the job was running and the flag is now set
   */
  public boolean requestCancel(long id) {
    return inTransaction("request cancel", conn -> store.requestCancel(conn, id, now()) > 0);
  }

  public List<Job> findStaleRunning(Instant heartbeatCutoff, int limit) {
    return inTransaction("find stale jobs", conn -> store.findStaleRunning(conn, heartbeatCutoff, limit));
  }

  public List<Job> findByState(JobState state, String jobType, int limit) {
    return inTransaction("query jobs", conn -> store.findByState(conn, state, jobType, limit));
  }

  public int countByState(JobState state, String jobType) {
    return inTransaction("count jobs", conn -> store.countByState(conn, state, jobType));
  }

  /**
   * Puts a {@code FAILED} job back to {@code PENDING} with a fresh retry budget.
   *
   * @return {@code true} if the job was failed and is now pending
   */
  public boolean requeueFailed(long id) {
    return inTransaction("requeue failed job", conn -> store.requeueFailed(conn, id, now()) > 0);
  }

  // ── Recurring schedules ────────────────────────────────────────

  /**
   * Inserts a schedule and its first occurrence atomically. If a schedule with the same id
   * already exists it is left untouched.
   *
   * @param schedule        the schedule row
   * @param firstOccurrence the job for {@code schedule.nextRunAt()}
   * @return {@code true} if the schedule was created, {@code false} if it already existed
   */
  public boolean insertSchedule(RecurringSchedule schedule, NewJob firstOccurrence) {
    return inTransaction("register schedule", conn -> {
      if (store.findSchedule(conn, schedule.scheduleId()).isPresent()) {
        return false;
      }
      Instant now = now();
      store.insertSchedule(conn, schedule);
      store.insertJob(conn, firstOccurrence.resolve(now, defaultMaxRetries), now);
      return true;
    });
  }

  public Optional<RecurringSchedule> findSchedule(String scheduleId) {
    return inTransaction("read schedule", conn -> store.findSchedule(conn, scheduleId));
  }

  /**
   * Reads a schedule.
   *
   * @throws JobNotFoundException if no schedule has this id
   */
  public RecurringSchedule readSchedule(String scheduleId) {
    return findSchedule(scheduleId).orElseThrow(() -> JobNotFoundException.schedule(scheduleId));
  }

  public List<RecurringSchedule> schedules() {
    return inTransaction("list schedules", store::findSchedules);
  }

  public Optional<Job> findOccurrence(String scheduleId, Instant occurrenceAt) {
    return inTransaction("find occurrence", conn -> store.findOccurrence(conn, scheduleId, occurrenceAt));
  }

  /**
   * Inserts a recurrence occurrence unless its slot is already materialized.
   *
   * @param occurrence a job carrying {@code recurringRef} and {@code occurrenceAt}
   * @return {@code true} if inserted, {@code false} if the slot already had a job
   */
  public boolean insertOccurrenceIfAbsent(NewJob occurrence) {
    String scheduleId = Objects.requireNonNull(occurrence.recurringRef(), "recurringRef");
    Instant slot = Objects.requireNonNull(occurrence.occurrenceAt(), "occurrenceAt");
    try {
      return inTransaction("insert occurrence", conn -> {
        if (store.findOccurrence(conn, scheduleId, slot).isPresent()) {
          return false;
        }
        Instant now = now();
        store.insertJob(conn, occurrence.resolve(now, defaultMaxRetries), now);
        return true;
      });
    } catch (StoreException e) {
      // A concurrent insert of the same slot trips the unique key
      if (findOccurrence(scheduleId, slot).isPresent()) {
        logger.log(Level.FINE, "Occurrence {0}@{1} inserted concurrently", new Object[]{scheduleId, slot});
        return false;
      }
      throw e;
    }
  }

  /**
   * Moves a schedule forward from {@code expectedNextRunAt} to {@code newNextRunAt}.
   *
   * @return {@code true} if advanced, {@code false} if another writer already moved it
   * @throws IllegalArgumentException if {@code newNextRunAt} is not after {@code expectedNextRunAt}
   */
  public boolean advanceSchedule(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt) {
    if (!newNextRunAt.isAfter(expectedNextRunAt)) {
      throw new IllegalArgumentException("Schedule " + scheduleId + " can only move forward: "
          + expectedNextRunAt + " -> " + newNextRunAt);
    }
    return inTransaction("advance schedule", conn ->
        store.advanceSchedule(conn, scheduleId, expectedNextRunAt, newNextRunAt, now()) > 0);
  }

  // ── Transactions ───────────────────────────────────────────────

  /**
   * Runs {@code work} in a single transaction on a fresh connection. Commits on normal return;
   * rolls back and rethrows on any exception. JDBC errors are wrapped in {@link StoreException}.
   *
   * @param action short description used in error messages
   * @param work   the transactional work
   * @return the work's result
   */
  public <T> T inTransaction(String action, TxWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private void requireApplied(Connection conn, int rows, long id, JobState expected,
      StateConflictException.Reason reason) {
    if (rows > 0) {
      return;
    }
    Job current = store.findJob(conn, id).orElseThrow(() -> JobNotFoundException.job(id));
    throw new StateConflictException(id, expected, current.state(), reason);
  }

  /**
   * Unit of work executed inside {@link #inTransaction}.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface TxWork<T> {
    T execute(Connection conn) throws SQLException;
  }
}
