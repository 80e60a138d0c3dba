package jobqueue.recurrence;

import java.time.Instant;

/**
 * Interprets the cadence expression of a recurring schedule.
 *
 * <p>Implementations must be deterministic: the same expression and instant always produce the
 * same next slot, and the slot is strictly after the given instant.
 *
 * @see IntervalCadenceEvaluator
 * @see CronCadenceEvaluator
 * @see CompositeCadenceEvaluator
 */
public interface CadenceEvaluator {

  /**
   * Checks that {@code cadence} can be evaluated.
   *
   * @param cadence the expression
   * @throws IllegalArgumentException if it cannot
   */
  void validate(String cadence);

  /**
   * Returns the first slot strictly after {@code after}.
   *
   * @param cadence the expression
   * @param after   the previous slot
   * @return the next slot
   * @throws IllegalArgumentException if the expression is invalid or has no further slot
   */
  Instant next(String cadence, Instant after);
}
