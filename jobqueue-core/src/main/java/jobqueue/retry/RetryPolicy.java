package jobqueue.retry;

/**
 * Decides what happens to a job after a failed attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Decides whether a failed attempt is retried and after how long.
   *
   * @param attempt    the attempt that just failed (1-based; equals the job's attempt counter)
   * @param maxRetries the job's retry ceiling
   * @return {@link RetryDecision.GiveUp} if {@code attempt > maxRetries}, otherwise a
   *     {@link RetryDecision.Retry} carrying the delay
   */
  RetryDecision decide(int attempt, int maxRetries);
}
