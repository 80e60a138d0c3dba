package jobqueue;

/**
 * Raised when a claimed job has no registered handler. The job is failed without retry and
 * this exception's message becomes its last error.
 */
public class UnhandledJobTypeException extends JobQueueException {
  private final String jobType;

  public UnhandledJobTypeException(String jobType) {
    super("UnhandledJobType: no handler registered for job type '" + jobType + "'");
    this.jobType = jobType;
  }

  public String jobType() {
    return jobType;
  }
}
