package jobqueue.recurrence;

import com.github.f4b6a3.ulid.UlidCreator;
import jobqueue.JobValidationException;
import jobqueue.NewJob;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.RecurringSchedule;
import jobqueue.spi.MetricsExporter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Materializes occurrences of recurring schedules.
 *
 * <p>A schedule always has exactly one materialized occurrence: the job for its
 * {@code nextRunAt} slot. When that occurrence finishes (succeeds, or fails for good) the engine
 * computes the following slot from {@code nextRunAt} (not from the wall clock, so a backlog is
 * worked off slot by slot and none is skipped), inserts the job for it, and only then advances
 * {@code nextRunAt}. The insert is idempotent on {@code (scheduleId, slot)}, so a crash between
 * the two steps is repaired by {@link #reconcile()} without duplicating the occurrence.
 */
public final class RecurrenceEngine {
  private static final Logger logger = Logger.getLogger(RecurrenceEngine.class.getName());

  private final JobLedger ledger;
  private final CadenceEvaluator cadenceEvaluator;
  private final MetricsExporter metrics;

  public RecurrenceEngine(JobLedger ledger, CadenceEvaluator cadenceEvaluator, MetricsExporter metrics) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.cadenceEvaluator = Objects.requireNonNull(cadenceEvaluator, "cadenceEvaluator");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public RecurrenceEngine(JobLedger ledger, CadenceEvaluator cadenceEvaluator) {
    this(ledger, cadenceEvaluator, MetricsExporter.NOOP);
  }

  public CadenceEvaluator cadenceEvaluator() {
    return cadenceEvaluator;
  }

  /**
   * Registers a schedule and inserts its first occurrence in one transaction. Registering an
   * id that already exists leaves the stored schedule unchanged.
   *
   * @param request the schedule definition
   * @return the schedule id
   * @throws JobValidationException if the cadence cannot be evaluated
   */
  public String register(RecurringJob request) {
    Objects.requireNonNull(request, "request");
    try {
      cadenceEvaluator.validate(request.cadence());
    } catch (IllegalArgumentException e) {
      throw new JobValidationException("Invalid cadence '" + request.cadence() + "': " + e.getMessage(), e);
    }
    Instant now = ledger.now();
    String scheduleId = request.scheduleId() != null
        ? request.scheduleId() : UlidCreator.getMonotonicUlid().toString();
    Instant firstSlot = truncate(request.firstRunAt() != null
        ? request.firstRunAt() : cadenceEvaluator.next(request.cadence(), now));
    int maxRetries = request.maxRetries() != null ? request.maxRetries() : ledger.defaultMaxRetries();

    RecurringSchedule schedule = new RecurringSchedule(scheduleId, request.jobType(),
        request.payload(), request.priority(), request.weight(), maxRetries, request.cadence(),
        firstSlot, now, now);
    if (ledger.insertSchedule(schedule, occurrence(schedule, firstSlot))) {
      metrics.incrementRecurrenceEnqueued();
      logger.log(Level.INFO, "Registered schedule {0} ({1}, cadence={2}), first run at {3}",
          new Object[]{scheduleId, request.jobType(), request.cadence(), firstSlot});
    } else {
      logger.log(Level.INFO, "Schedule {0} already registered; keeping stored definition", scheduleId);
    }
    return scheduleId;
  }

  /**
   * Schedules the successor of a finished occurrence. Occurrences that are not the schedule's
   * current slot (already superseded) are ignored.
   *
   * @param finished a terminal job carrying a recurring reference
   * @return {@code true} if the schedule advanced
   */
  public boolean onOccurrenceFinished(Job finished) {
    if (!finished.isRecurring() || !finished.state().isTerminal()) {
      return false;
    }
    Optional<RecurringSchedule> found = ledger.findSchedule(finished.recurringRef());
    if (found.isEmpty()) {
      logger.log(Level.WARNING, "Job {0} references unknown schedule {1}",
          new Object[]{finished.id(), finished.recurringRef()});
      return false;
    }
    RecurringSchedule schedule = found.get();
    if (!schedule.nextRunAt().equals(finished.occurrenceAt())) {
      logger.log(Level.FINE, "Occurrence {0} of {1} is not the current slot {2}",
          new Object[]{finished.occurrenceAt(), schedule.scheduleId(), schedule.nextRunAt()});
      return false;
    }
    return advance(schedule);
  }

  /**
   * Repairs schedules left behind by a crash: a schedule whose current slot has no job gets
   * one, and a schedule whose current occurrence already finished is advanced.
   *
   * @return the number of schedules repaired
   */
  public int reconcile() {
    int repaired = 0;
    for (RecurringSchedule schedule : ledger.schedules()) {
      try {
        Optional<Job> current = ledger.findOccurrence(schedule.scheduleId(), schedule.nextRunAt());
        if (current.isEmpty()) {
          if (insertOccurrence(schedule, schedule.nextRunAt())) {
            repaired++;
          }
        } else if (current.get().state().isTerminal() && advance(schedule)) {
          repaired++;
        }
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to reconcile schedule " + schedule.scheduleId(), e);
      }
    }
    if (repaired > 0) {
      logger.log(Level.INFO, "Reconciled {0} recurring schedule(s)", repaired);
    }
    return repaired;
  }

  private boolean advance(RecurringSchedule schedule) {
    Instant current = schedule.nextRunAt();
    Instant next = truncate(cadenceEvaluator.next(schedule.cadence(), current));
    if (!next.isAfter(current)) {
      throw new IllegalStateException("Cadence '" + schedule.cadence() + "' of schedule "
          + schedule.scheduleId() + " did not move past " + current);
    }
    insertOccurrence(schedule, next);
    boolean advanced = ledger.advanceSchedule(schedule.scheduleId(), current, next);
    if (advanced) {
      logger.log(Level.FINE, "Schedule {0} advanced {1} -> {2}",
          new Object[]{schedule.scheduleId(), current, next});
    }
    return advanced;
  }

  private boolean insertOccurrence(RecurringSchedule schedule, Instant slot) {
    boolean inserted = ledger.insertOccurrenceIfAbsent(occurrence(schedule, slot));
    if (inserted) {
      metrics.incrementRecurrenceEnqueued();
    }
    return inserted;
  }

  private static NewJob occurrence(RecurringSchedule schedule, Instant slot) {
    return NewJob.builder(schedule.jobType())
        .payload(schedule.payload())
        .priority(schedule.priority())
        .weight(schedule.weight())
        .maxRetries(schedule.maxRetries())
        .runAt(slot)
        .recurrence(schedule.scheduleId(), slot)
        .build();
  }

  private static Instant truncate(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }
}
