package jobqueue.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of {@link RetryPolicy#decide(int, int)}.
 *
 * <ul>
 *   <li>{@link Retry}: put the job back to {@code PENDING} with {@code run_at = now + delay}.</li>
 *   <li>{@link GiveUp}: move the job to {@code FAILED}.</li>
 * </ul>
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

  GiveUp GIVE_UP = new GiveUp();

  static Retry retryAfter(Duration delay) {
    return new Retry(delay);
  }

  static GiveUp giveUp() {
    return GIVE_UP;
  }

  /**
   * Retry after the given delay.
   *
   * @param delay how long to wait before the job becomes claimable again (not negative)
   */
  record Retry(Duration delay) implements RetryDecision {
    public Retry {
      Objects.requireNonNull(delay, "delay must not be null");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delay must not be negative");
      }
    }
  }

  /** Retries are exhausted. */
  record GiveUp() implements RetryDecision {
  }
}
