package jobqueue.spi;

import jobqueue.JobUpdate;
import jobqueue.NewJob;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.model.RecurringSchedule;
import jobqueue.model.RunInfo;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store adapter for jobs, run history and recurring schedules.
 *
 * <p>Every method runs on the caller's connection and never commits, rolls back or closes it;
 * transaction boundaries belong to {@link jobqueue.ledger.JobLedger}. Methods that return an
 * {@code int} report the number of rows affected; a guarded write that matched no row returns
 * {@code 0} rather than throwing.
 *
 * <p>The required primitive is {@link #transition}: a compare-and-set on the job's state.
 * Everything else the queue guarantees is built on it.
 *
 * @see jobqueue.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  /**
   * Inserts a new {@code PENDING} job with {@code attempt = 0}.
   *
   * @param conn the active connection
   * @param job  a request with {@code runAt} and {@code maxRetries} resolved
   * @param now  creation time
   * @return the store-assigned id, strictly greater than every id assigned before
   */
  long insertJob(Connection conn, NewJob job, Instant now);

  /**
   * Reads a job by id.
   *
   * @param conn the active connection
   * @param id   the job id
   * @return the job, or empty if no such row exists
   */
  Optional<Job> findJob(Connection conn, long id);

  /**
   * Selects the best-ranked ready job without changing it.
   *
   * <p>Ready means {@code state = PENDING AND run_at <= now}. Ranking is priority descending,
   * then {@code run_at} ascending, then id ascending. Implementations may lock the selected row
   * (for example with {@code FOR UPDATE SKIP LOCKED}) to reduce contention, but correctness
   * comes from the guarded {@link #transition} that follows.
   *
   * @param conn      the active connection
   * @param now       the claim time
   * @param jobTypes  restricts candidates to these types; empty means any type
   * @param maxWeight only jobs with {@code weight <= maxWeight} qualify
   * @return the top candidate, or empty if none is ready
   */
  Optional<Job> selectNextReady(Connection conn, Instant now, Set<String> jobTypes, int maxWeight);

  /**
   * Guarded compare-and-transition.
   *
   * @param conn       the active connection
   * @param id         the job id
   * @param expected   state the row must be in for the write to apply
   * @param transition the new state and accompanying field changes
   * @param now        the write time, stored as {@code updated_at} (and {@code heartbeat_at}
   *                   for claims)
   * @return 1 if applied, 0 if the row is missing or the guard failed
   */
  int transition(Connection conn, long id, JobState expected, JobTransition transition, Instant now);

  /**
   * Overwrites the checkpoint of a {@code RUNNING} job.
   *
   * @return 1 if written, 0 if the job is not running
   */
  int writeCheckpoint(Connection conn, long id, int attempt, byte[] checkpoint, Instant now);

  /**
   * Refreshes {@code heartbeat_at} of a {@code RUNNING} job on the given attempt.
   *
   * @return 1 if refreshed, 0 if the job is no longer held by that attempt
   */
  int heartbeat(Connection conn, long id, int attempt, Instant now);

  /**
   * Raises the cooperative cancel flag on a {@code RUNNING} job.
   *
   * @return 1 if the flag was set, 0 if the job is not running
   */
  int requestCancel(Connection conn, long id, Instant now);

  /**
   * Applies field changes to a job that is still {@code PENDING}.
   *
   * @return 1 if applied, 0 if the job is missing or not pending
   */
  int updateIfPending(Connection conn, long id, JobUpdate update, Instant now);

  /**
   * Lists {@code RUNNING} jobs whose heartbeat is older than {@code heartbeatCutoff}.
   */
  List<Job> findStaleRunning(Connection conn, Instant heartbeatCutoff, int limit);

  /**
   * Lists jobs in the given state, oldest first.
   *
   * @param jobType optional type filter ({@code null} for all)
   */
  List<Job> findByState(Connection conn, JobState state, String jobType, int limit);

  /**
   * Counts jobs in the given state.
   *
   * @param jobType optional type filter ({@code null} for all)
   */
  int countByState(Connection conn, JobState state, String jobType);

  /**
   * Administrative re-queue of a {@code FAILED} job: {@code PENDING}, {@code run_at = now},
   * {@code max_retries = attempt + max_retries}. The attempt counter keeps growing, so the
   * job gets its original retry budget again on top of the attempts already spent.
   *
   * @return 1 if re-queued, 0 if the job is missing or not failed
   */
  int requeueFailed(Connection conn, long id, Instant now);

  /** Opens the run-history entry for a freshly claimed attempt. */
  void insertRun(Connection conn, long jobId, int attempt, Instant startedAt);

  /**
   * Closes the run-history entry of an attempt.
   *
   * @return 1 if closed, 0 if there was no open entry
   */
  int finishRun(Connection conn, long jobId, int attempt, Instant finishedAt, boolean success, String info);

  /** Returns the run history of a job ordered by attempt. */
  List<RunInfo> findRuns(Connection conn, long jobId);

  /** Inserts a recurring schedule. */
  void insertSchedule(Connection conn, RecurringSchedule schedule);

  Optional<RecurringSchedule> findSchedule(Connection conn, String scheduleId);

  /** Lists all recurring schedules ordered by id. */
  List<RecurringSchedule> findSchedules(Connection conn);

  /**
   * Moves a schedule's {@code next_run_at} forward, guarded on its current value.
   *
   * @return 1 if advanced, 0 if the schedule is missing or already moved
   */
  int advanceSchedule(Connection conn, String scheduleId, Instant expectedNextRunAt,
      Instant newNextRunAt, Instant now);

  /**
   * Finds the job materialized for a schedule slot.
   *
   * @param scheduleId   the schedule id
   * @param occurrenceAt the slot (idempotency key)
   * @return the job, or empty if the slot has not been materialized
   */
  Optional<Job> findOccurrence(Connection conn, String scheduleId, Instant occurrenceAt);
}
