package jobqueue.recurrence;

import java.time.Instant;
import java.util.Objects;

/**
 * Default evaluator: cron when the expression parses as cron, a fixed interval otherwise.
 */
public final class CompositeCadenceEvaluator implements CadenceEvaluator {
  private final CronCadenceEvaluator cron;
  private final IntervalCadenceEvaluator interval;

  public CompositeCadenceEvaluator() {
    this(new CronCadenceEvaluator(), new IntervalCadenceEvaluator());
  }

  public CompositeCadenceEvaluator(CronCadenceEvaluator cron, IntervalCadenceEvaluator interval) {
    this.cron = Objects.requireNonNull(cron, "cron");
    this.interval = Objects.requireNonNull(interval, "interval");
  }

  @Override
  public void validate(String cadence) {
    delegate(cadence).validate(cadence);
  }

  @Override
  public Instant next(String cadence, Instant after) {
    return delegate(cadence).next(cadence, after);
  }

  private CadenceEvaluator delegate(String cadence) {
    return CronCadenceEvaluator.isCron(cadence) ? cron : interval;
  }
}
