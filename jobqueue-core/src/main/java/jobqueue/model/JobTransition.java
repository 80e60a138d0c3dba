package jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Field changes applied together with a guarded state change.
 *
 * <p>The store applies a transition only if the row is still in the expected state and, when
 * {@link #expectedAttempt()} is not {@link #ANY_ATTEMPT}, still on that attempt. A non-null
 * {@link #heartbeatBefore()} additionally requires {@code heartbeat_at} to be older than the
 * given instant, which keeps orphan recovery from racing a live heartbeat.
 *
 * @param target          the new state
 * @param runAt           new {@code run_at}, or {@code null} to keep it
 * @param claimAttempt    increment {@code attempt} and set {@code heartbeat_at} to now
 * @param lastError       error text to record when leaving {@code RUNNING}
 * @param expectedAttempt attempt guard, or {@link #ANY_ATTEMPT}
 * @param heartbeatBefore staleness guard, or {@code null}
 */
public record JobTransition(
    JobState target,
    Instant runAt,
    boolean claimAttempt,
    String lastError,
    int expectedAttempt,
    Instant heartbeatBefore) {

  public static final int ANY_ATTEMPT = -1;

  /** Error text recorded when the recovery sweep returns an orphaned claim. */
  public static final String ORPHANED = "orphaned: heartbeat expired";

  public JobTransition {
    Objects.requireNonNull(target, "target");
    if (claimAttempt && target != JobState.RUNNING) {
      throw new IllegalArgumentException("claim transitions must target RUNNING");
    }
  }

  /** {@code PENDING -> RUNNING}: bumps the attempt counter and stamps the heartbeat. */
  public static JobTransition claim() {
    return new JobTransition(JobState.RUNNING, null, true, null, ANY_ATTEMPT, null);
  }

  /** {@code RUNNING -> SUCCEEDED} for the given attempt. */
  public static JobTransition succeed(int attempt) {
    return new JobTransition(JobState.SUCCEEDED, null, false, null, attempt, null);
  }

  /** {@code RUNNING -> PENDING} with a new run time after a handler failure. */
  public static JobTransition retry(int attempt, Instant runAt, String error) {
    Objects.requireNonNull(runAt, "runAt");
    return new JobTransition(JobState.PENDING, runAt, false, error, attempt, null);
  }

  /** {@code RUNNING -> FAILED}; no further attempts. */
  public static JobTransition fail(int attempt, String error) {
    return new JobTransition(JobState.FAILED, null, false, error, attempt, null);
  }

  /**
   * {@code RUNNING -> PENDING} for an orphaned claim. The attempt counter is left unchanged.
   *
   * @param attempt        attempt observed when the orphan was found
   * @param runAt          new run time, normally now
   * @param staleCutoff    the heartbeat must still be older than this
   */
  public static JobTransition recover(int attempt, Instant runAt, Instant staleCutoff) {
    Objects.requireNonNull(staleCutoff, "staleCutoff");
    return new JobTransition(JobState.PENDING, runAt, false, ORPHANED, attempt, staleCutoff);
  }

  /** {@code PENDING -> CANCELLED}. */
  public static JobTransition cancel() {
    return new JobTransition(JobState.CANCELLED, null, false, null, ANY_ATTEMPT, null);
  }
}
