package jobqueue.jdbc.store;

import jobqueue.JobUpdate;
import jobqueue.NewJob;
import jobqueue.jdbc.JdbcTemplate;
import jobqueue.jdbc.TableNames;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.model.RecurringSchedule;
import jobqueue.model.RunInfo;
import jobqueue.spi.JobStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #lockClause()} to lock the claim candidate and
 * {@link #insertJob} where the database returns keys differently. Register custom
 * implementations via {@code META-INF/services/jobqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * <p>All instants are truncated to milliseconds before they are written, so values read back
 * compare equal to the ones the caller holds.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final String JOB_COLUMNS = "id, job_type, payload, priority, weight, run_at, "
      + "orig_run_at, state, attempt, max_retries, checkpoint_data, heartbeat_at, cancel_requested, "
      + "recurring_ref, occurrence_at, last_error, created_at, updated_at";

  private static final String SCHEDULE_COLUMNS = "schedule_id, job_type, payload, priority, weight, "
      + "max_retries, cadence, next_run_at, created_at, updated_at";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> new Job(
      rs.getLong("id"),
      rs.getString("job_type"),
      rs.getBytes("payload"),
      rs.getInt("priority"),
      rs.getInt("weight"),
      instant(rs, "run_at"),
      instant(rs, "orig_run_at"),
      JobState.fromCode(rs.getInt("state")),
      rs.getInt("attempt"),
      rs.getInt("max_retries"),
      rs.getBytes("checkpoint_data"),
      instant(rs, "heartbeat_at"),
      rs.getBoolean("cancel_requested"),
      rs.getString("recurring_ref"),
      instant(rs, "occurrence_at"),
      rs.getString("last_error"),
      instant(rs, "created_at"),
      instant(rs, "updated_at"));

  private static final JdbcTemplate.RowMapper<RunInfo> RUN_ROW_MAPPER = rs -> {
    boolean success = rs.getBoolean("success");
    Boolean outcome = rs.wasNull() ? null : success;
    return new RunInfo(rs.getInt("attempt"), instant(rs, "started_at"), instant(rs, "finished_at"),
        outcome, rs.getString("info"));
  };

  private static final JdbcTemplate.RowMapper<RecurringSchedule> SCHEDULE_ROW_MAPPER =
      rs -> new RecurringSchedule(
          rs.getString("schedule_id"),
          rs.getString("job_type"),
          rs.getBytes("payload"),
          rs.getInt("priority"),
          rs.getInt("weight"),
          rs.getInt("max_retries"),
          rs.getString("cadence"),
          instant(rs, "next_run_at"),
          instant(rs, "created_at"),
          instant(rs, "updated_at"));

  private final String tablePrefix;
  private final String jobs;
  private final String runs;
  private final String schedules;

  protected AbstractJdbcJobStore() {
    this(TableNames.DEFAULT_PREFIX);
  }

  protected AbstractJdbcJobStore(String tablePrefix) {
    this.tablePrefix = TableNames.validatePrefix(tablePrefix);
    this.jobs = TableNames.jobs(tablePrefix);
    this.runs = TableNames.runs(tablePrefix);
    this.schedules = TableNames.schedules(tablePrefix);
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2"). Also names the
   * bundled schema script.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind that uses the given table prefix.
   *
   * @param tablePrefix the table prefix
   * @return a new store instance
   */
  public abstract AbstractJdbcJobStore withTablePrefix(String tablePrefix);

  public String tablePrefix() {
    return tablePrefix;
  }

  protected String jobsTable() {
    return jobs;
  }

  /**
   * Row-locking clause appended to the claim candidate query, or an empty string. The guarded
   * transition that follows is what prevents double claims; the lock only reduces contention.
   */
  protected String lockClause() {
    return "";
  }

  // ── Jobs ───────────────────────────────────────────────────────

  @Override
  public long insertJob(Connection conn, NewJob job, Instant now) {
    return JdbcTemplate.insertReturningKey(conn, insertJobSql(""), insertJobParams(job, now));
  }

  /** INSERT statement for a new job, with an optional dialect-specific suffix. */
  protected String insertJobSql(String suffix) {
    return "INSERT INTO " + jobs + " (" +
        "job_type, payload, priority, weight, run_at, orig_run_at, state, attempt, max_retries, " +
        "checkpoint_data, heartbeat_at, cancel_requested, recurring_ref, occurrence_at, last_error, " +
        "created_at, updated_at" +
        ") VALUES (?,?,?,?,?,?," + JobState.PENDING.code() + ",0,?,NULL,NULL,FALSE,?,?,NULL,?,?)" + suffix;
  }

  protected Object[] insertJobParams(NewJob job, Instant now) {
    Timestamp runAt = ts(job.runAt());
    Timestamp created = ts(now);
    return new Object[]{job.jobType(), job.payload(), job.priority(), job.weight(), runAt, runAt,
        job.maxRetries(), job.recurringRef(), ts(job.occurrenceAt()), created, created};
  }

  @Override
  public Optional<Job> findJob(Connection conn, long id) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobs + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, id));
  }

  @Override
  public Optional<Job> selectNextReady(Connection conn, Instant now, Set<String> jobTypes, int maxWeight) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(JOB_COLUMNS).append(" FROM ").append(jobs)
        .append(" WHERE state=").append(JobState.PENDING.code())
        .append(" AND run_at <= ? AND weight <= ?");
    params.add(ts(now));
    params.add(maxWeight);
    if (!jobTypes.isEmpty()) {
      sql.append(" AND job_type IN (").append(String.join(",", Collections.nCopies(jobTypes.size(), "?")))
          .append(")");
      params.addAll(jobTypes);
    }
    sql.append(" ORDER BY priority DESC, run_at, id LIMIT 1").append(lockClause());
    return first(JdbcTemplate.query(conn, sql.toString(), JOB_ROW_MAPPER, params.toArray()));
  }

  @Override
  public int transition(Connection conn, long id, JobState expected, JobTransition t, Instant now) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("UPDATE ").append(jobs).append(" SET state=?, updated_at=?");
    params.add(t.target().code());
    params.add(ts(now));
    if (t.runAt() != null) {
      sql.append(", run_at=?");
      params.add(ts(t.runAt()));
    }
    if (t.claimAttempt()) {
      sql.append(", attempt=attempt+1, heartbeat_at=?");
      params.add(ts(now));
    }
    if (t.lastError() != null) {
      sql.append(", last_error=?");
      params.add(truncateError(t.lastError()));
    }
    if (expected == JobState.RUNNING) {
      sql.append(", cancel_requested=FALSE");
    }
    sql.append(" WHERE id=? AND state=?");
    params.add(id);
    params.add(expected.code());
    if (t.expectedAttempt() != JobTransition.ANY_ATTEMPT) {
      sql.append(" AND attempt=?");
      params.add(t.expectedAttempt());
    }
    if (t.heartbeatBefore() != null) {
      sql.append(" AND (heartbeat_at IS NULL OR heartbeat_at < ?)");
      params.add(ts(t.heartbeatBefore()));
    }
    return JdbcTemplate.update(conn, sql.toString(), params.toArray());
  }

  @Override
  public int writeCheckpoint(Connection conn, long id, int attempt, byte[] checkpoint, Instant now) {
    String sql = "UPDATE " + jobs + " SET checkpoint_data=?, updated_at=?" +
        " WHERE id=? AND state=" + JobState.RUNNING.code() + " AND attempt=?";
    return JdbcTemplate.update(conn, sql, checkpoint, ts(now), id, attempt);
  }

  @Override
  public int heartbeat(Connection conn, long id, int attempt, Instant now) {
    String sql = "UPDATE " + jobs + " SET heartbeat_at=?" +
        " WHERE id=? AND state=" + JobState.RUNNING.code() + " AND attempt=?";
    return JdbcTemplate.update(conn, sql, ts(now), id, attempt);
  }

  @Override
  public int requestCancel(Connection conn, long id, Instant now) {
    String sql = "UPDATE " + jobs + " SET cancel_requested=TRUE, updated_at=?" +
        " WHERE id=? AND state=" + JobState.RUNNING.code();
    return JdbcTemplate.update(conn, sql, ts(now), id);
  }

  @Override
  public int updateIfPending(Connection conn, long id, JobUpdate update, Instant now) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("UPDATE ").append(jobs).append(" SET updated_at=?");
    params.add(ts(now));
    if (update.payload() != null) {
      sql.append(", payload=?");
      params.add(update.payload());
    }
    if (update.priority() != null) {
      sql.append(", priority=?");
      params.add(update.priority());
    }
    if (update.weight() != null) {
      sql.append(", weight=?");
      params.add(update.weight());
    }
    if (update.runAt() != null) {
      sql.append(", run_at=?");
      params.add(ts(update.runAt()));
    }
    if (update.maxRetries() != null) {
      sql.append(", max_retries=?");
      params.add(update.maxRetries());
    }
    sql.append(" WHERE id=? AND state=").append(JobState.PENDING.code());
    params.add(id);
    return JdbcTemplate.update(conn, sql.toString(), params.toArray());
  }

  @Override
  public List<Job> findStaleRunning(Connection conn, Instant heartbeatCutoff, int limit) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobs +
        " WHERE state=" + JobState.RUNNING.code() +
        " AND (heartbeat_at IS NULL OR heartbeat_at < ?) ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, ts(heartbeatCutoff), limit);
  }

  @Override
  public List<Job> findByState(Connection conn, JobState state, String jobType, int limit) {
    if (jobType == null) {
      String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobs + " WHERE state=? ORDER BY id LIMIT ?";
      return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, state.code(), limit);
    }
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobs +
        " WHERE state=? AND job_type=? ORDER BY id LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, state.code(), jobType, limit);
  }

  @Override
  public int countByState(Connection conn, JobState state, String jobType) {
    List<Integer> counts = jobType == null
        ? JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + jobs + " WHERE state=?",
            rs -> rs.getInt(1), state.code())
        : JdbcTemplate.query(conn, "SELECT COUNT(*) FROM " + jobs + " WHERE state=? AND job_type=?",
            rs -> rs.getInt(1), state.code(), jobType);
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public int requeueFailed(Connection conn, long id, Instant now) {
    Timestamp ts = ts(now);
    String sql = "UPDATE " + jobs + " SET state=" + JobState.PENDING.code() +
        ", run_at=?, max_retries=attempt+max_retries, cancel_requested=FALSE, updated_at=?" +
        " WHERE id=? AND state=" + JobState.FAILED.code();
    return JdbcTemplate.update(conn, sql, ts, ts, id);
  }

  // ── Run history ────────────────────────────────────────────────

  @Override
  public void insertRun(Connection conn, long jobId, int attempt, Instant startedAt) {
    String sql = "INSERT INTO " + runs + " (job_id, attempt, started_at, finished_at, success, info)" +
        " VALUES (?,?,?,NULL,NULL,NULL)";
    JdbcTemplate.update(conn, sql, jobId, attempt, ts(startedAt));
  }

  @Override
  public int finishRun(Connection conn, long jobId, int attempt, Instant finishedAt, boolean success,
      String info) {
    String sql = "UPDATE " + runs + " SET finished_at=?, success=?, info=?" +
        " WHERE job_id=? AND attempt=? AND finished_at IS NULL";
    return JdbcTemplate.update(conn, sql, ts(finishedAt), success, truncateError(info), jobId, attempt);
  }

  @Override
  public List<RunInfo> findRuns(Connection conn, long jobId) {
    String sql = "SELECT attempt, started_at, finished_at, success, info FROM " + runs +
        " WHERE job_id=? ORDER BY attempt";
    return JdbcTemplate.query(conn, sql, RUN_ROW_MAPPER, jobId);
  }

  // ── Schedules ──────────────────────────────────────────────────

  @Override
  public void insertSchedule(Connection conn, RecurringSchedule s) {
    String sql = "INSERT INTO " + schedules + " (" + SCHEDULE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, s.scheduleId(), s.jobType(), s.payload(), s.priority(), s.weight(),
        s.maxRetries(), s.cadence(), ts(s.nextRunAt()), ts(s.createdAt()), ts(s.updatedAt()));
  }

  @Override
  public Optional<RecurringSchedule> findSchedule(Connection conn, String scheduleId) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + schedules + " WHERE schedule_id=?";
    return first(JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER, scheduleId));
  }

  @Override
  public List<RecurringSchedule> findSchedules(Connection conn) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + schedules + " ORDER BY schedule_id";
    return JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER);
  }

  @Override
  public int advanceSchedule(Connection conn, String scheduleId, Instant expectedNextRunAt,
      Instant newNextRunAt, Instant now) {
    String sql = "UPDATE " + schedules + " SET next_run_at=?, updated_at=?" +
        " WHERE schedule_id=? AND next_run_at=?";
    return JdbcTemplate.update(conn, sql, ts(newNextRunAt), ts(now), scheduleId, ts(expectedNextRunAt));
  }

  @Override
  public Optional<Job> findOccurrence(Connection conn, String scheduleId, Instant occurrenceAt) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobs + " WHERE recurring_ref=? AND occurrence_at=?";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, scheduleId, ts(occurrenceAt)));
  }

  // ── Helpers ────────────────────────────────────────────────────

  protected static Timestamp ts(Instant instant) {
    return instant == null ? null : Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  private static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
