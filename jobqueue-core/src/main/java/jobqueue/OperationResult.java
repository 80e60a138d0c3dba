package jobqueue;

import jobqueue.model.JobState;

import java.util.Objects;

/**
 * Outcome of {@link JobQueue#cancel(long)} and {@link JobQueue#modify(long, JobUpdate)}.
 *
 * <ul>
 *   <li>{@link Ok}: the guarded write committed while the job was still {@code PENDING}.</li>
 *   <li>{@link Conflict}: the job had already moved on, typically because a worker claimed it
 *       first. The job's own progress is unaffected.</li>
 * </ul>
 */
public sealed interface OperationResult permits OperationResult.Ok, OperationResult.Conflict {

  /** Singleton success result. */
  Ok OK = new Ok();

  static Ok ok() {
    return OK;
  }

  static Conflict conflict(StateConflictException cause) {
    return new Conflict(cause.reason(), cause.actual());
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  /** The guarded write committed. */
  record Ok() implements OperationResult {
  }

  /**
   * The guarded write was rejected.
   *
   * @param reason      why it was rejected
   * @param actualState the state the job was in at the time
   */
  record Conflict(StateConflictException.Reason reason, JobState actualState)
      implements OperationResult {
    public Conflict {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
