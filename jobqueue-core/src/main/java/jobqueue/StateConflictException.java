package jobqueue;

import jobqueue.model.JobState;

/**
 * Thrown when a guarded transition loses a race: the row was no longer in the expected state
 * when the write was applied. Always recoverable by re-reading the job.
 */
public final class StateConflictException extends JobQueueException {

  /** Why the guarded write was rejected. */
  public enum Reason {
    /** Cancel or modify was attempted on a job that is no longer {@code PENDING}. */
    NOT_PENDING,
    /** The row left the expected state (or attempt) before the write committed. */
    STATE_CHANGED
  }

  private final long jobId;
  private final JobState expected;
  private final JobState actual;
  private final Reason reason;

  public StateConflictException(long jobId, JobState expected, JobState actual, Reason reason) {
    super("Job " + jobId + " expected " + expected + " but was " + actual + " (" + reason + ")");
    this.jobId = jobId;
    this.expected = expected;
    this.actual = actual;
    this.reason = reason;
  }

  public long jobId() {
    return jobId;
  }

  public JobState expected() {
    return expected;
  }

  public JobState actual() {
    return actual;
  }

  public Reason reason() {
    return reason;
  }
}
