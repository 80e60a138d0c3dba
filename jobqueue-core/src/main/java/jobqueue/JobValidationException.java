package jobqueue;

/**
 * Thrown when an enqueue, modify or schedule registration request is malformed. Raised before
 * anything is written to the store.
 */
public final class JobValidationException extends JobQueueException {

  public JobValidationException(String message) {
    super(message);
  }

  public JobValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
