package jobqueue.model;

/**
 * Lifecycle state of a job.
 *
 * <p>Codes are persisted by the store and must never be renumbered. The only legal edges are
 * {@code PENDING -> RUNNING}, {@code RUNNING -> SUCCEEDED}, {@code RUNNING -> PENDING} (retry or
 * orphan recovery), {@code RUNNING -> FAILED} and {@code PENDING -> CANCELLED}.
 */
public enum JobState {
  PENDING(0),
  RUNNING(1),
  SUCCEEDED(2),
  FAILED(3),
  CANCELLED(4);

  private final int code;

  JobState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELLED;
  }

  /**
   * Returns whether the state machine has an edge from this state to {@code target}.
   *
   * @param target the requested next state
   * @return {@code true} if the edge exists
   */
  public boolean canTransitionTo(JobState target) {
    return switch (this) {
      case PENDING -> target == RUNNING || target == CANCELLED;
      case RUNNING -> target == SUCCEEDED || target == PENDING || target == FAILED;
      case SUCCEEDED, FAILED, CANCELLED -> false;
    };
  }

  public static JobState fromCode(int code) {
    for (JobState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown job state code: " + code);
  }
}
