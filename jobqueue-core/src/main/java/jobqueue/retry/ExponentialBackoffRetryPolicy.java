package jobqueue.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with bounded jitter.
 *
 * <p>Gives up once {@code attempt > maxRetries}, so a job with {@code maxRetries = 2} runs at
 * most three times. Otherwise the delay is {@code baseDelay * 2^(attempt-1)}, capped at
 * {@code maxDelay}, then scaled by a uniform factor in {@code [1 - jitter, 1 + jitter)} and
 * capped again. {@link #baseDelayMs(int)} exposes the jitter-free sequence, which depends on
 * the attempt alone.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final double DEFAULT_JITTER = 0.2;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_JITTER);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
    this(baseDelay.toMillis(), maxDelay.toMillis(), jitter);
  }

  @Override
  public RetryDecision decide(int attempt, int maxRetries) {
    if (attempt > maxRetries) {
      return RetryDecision.giveUp();
    }
    return RetryDecision.retryAfter(Duration.ofMillis(computeDelayMs(attempt)));
  }

  /**
   * Jittered delay before retrying after the given attempt.
   *
   * @param attempt the failed attempt (1-based)
   * @return delay in milliseconds, never above {@code maxDelayMs}
   */
  public long computeDelayMs(int attempt) {
    long capped = baseDelayMs(attempt);
    if (jitter == 0 || capped == 0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1 - jitter, 1 + jitter);
    long withJitter = (long) (capped * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  /**
   * Jitter-free delay for the given attempt: {@code baseDelay * 2^(attempt-1)} capped at
   * {@code maxDelay}.
   *
   * @param attempt the failed attempt (1-based); values below 1 yield {@code 0}
   * @return delay in milliseconds
   */
  public long baseDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    if (attempt >= 63) {
      return maxDelayMs;
    }
    long shift = 1L << (attempt - 1);
    // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
    if (shift > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * shift);
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitter() {
    return jitter;
  }
}
