package jobqueue.worker;

import jobqueue.JobCancelledException;
import jobqueue.StateConflictException;

import java.util.Optional;

/**
 * What a {@link JobHandler} sees of the attempt it is running.
 *
 * <p>Instances are created by the worker pool for a single attempt and must not be used after
 * the handler returns.
 */
public interface JobContext {

  long jobId();

  String jobType();

  /** Returns a copy of the job payload; never {@code null}. */
  byte[] payload();

  /** The 1-based number of this attempt. */
  int attempt();

  int maxRetries();

  /**
   * Returns the most recently committed checkpoint, including ones saved earlier in this
   * attempt or by an earlier attempt.
   */
  Optional<byte[]> checkpoint();

  /**
   * Durably replaces the job's checkpoint. The write is committed before this method returns,
   * so it survives a crash of this process.
   *
   * @param checkpoint opaque progress marker
   * @throws StateConflictException if this attempt no longer owns the job
   */
  void checkpoint(byte[] checkpoint);

  /**
   * Refreshes the job's liveness timestamp ahead of the pool's own heartbeat schedule.
   *
   * @throws StateConflictException if this attempt no longer owns the job
   */
  void heartbeat();

  /** Returns {@code true} once a caller asked for this running job to be cancelled. */
  boolean isCancelRequested();

  /**
   * Convenience for handlers that poll for cancellation between units of work.
   *
   * @throws JobCancelledException if cancellation was requested
   */
  default void throwIfCancelRequested() {
    if (isCancelRequested()) {
      throw new JobCancelledException(jobId());
    }
  }
}
