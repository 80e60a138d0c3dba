package jobqueue.worker;

/**
 * Executes jobs of one type.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run on worker pool threads, one invocation per claimed attempt. The same job may
 * be handed to a handler more than once (after a failure, or after a crash recovered the claim),
 * so side effects should be idempotent. Long-running handlers should save progress with
 * {@link JobContext#checkpoint(byte[])} and resume from {@link JobContext#checkpoint()}.
 *
 * <h2>Error Handling</h2>
 * <p>Returning normally marks the job {@code SUCCEEDED}. Throwing any exception hands the
 * attempt to the retry policy: the job is rescheduled with backoff, or failed once its retry
 * budget is spent. Throwing {@link jobqueue.JobCancelledException} fails it immediately.
 *
 * <pre>{@code
 * registry.register("resize-image", ctx -> {
 *   int done = ctx.checkpoint().map(Ints::fromByteArray).orElse(0);
 *   for (int i = done; i < tiles; i++) {
 *     ctx.throwIfCancelRequested();
 *     resize(i);
 *     ctx.checkpoint(Ints.toByteArray(i + 1));
 *   }
 * });
 * }</pre>
 */
@FunctionalInterface
public interface JobHandler {

  /**
   * Runs one attempt of a job.
   *
   * @param context the job's payload, checkpoint and control surface
   * @throws Exception if the attempt failed
   */
  void handle(JobContext context) throws Exception;
}
