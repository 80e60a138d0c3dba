package jobqueue;

/**
 * Thrown by a handler to acknowledge a cooperative cancel request.
 *
 * <p>A job whose handler ends with this exception is failed immediately, without consulting the
 * retry policy.
 *
 * @see jobqueue.worker.JobContext#throwIfCancelRequested()
 */
public class JobCancelledException extends JobQueueException {
  private final long jobId;

  public JobCancelledException(long jobId) {
    super("cancelled: job " + jobId + " was cancelled while running");
    this.jobId = jobId;
  }

  public long jobId() {
    return jobId;
  }
}
