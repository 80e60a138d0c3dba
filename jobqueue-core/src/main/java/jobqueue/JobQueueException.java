package jobqueue;

/**
 * Base class of every error the queue reports to callers.
 *
 * <p>All subclasses are unchecked. Store failures are reported as
 * {@link jobqueue.spi.StoreException}; exhausted retries are never thrown and only show up as
 * the job's {@link jobqueue.model.JobState#FAILED FAILED} state.
 */
public abstract class JobQueueException extends RuntimeException {

  protected JobQueueException(String message) {
    super(message);
  }

  protected JobQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
