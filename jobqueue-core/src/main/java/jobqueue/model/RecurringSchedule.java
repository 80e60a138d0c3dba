package jobqueue.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A job template plus a cadence rule. {@code nextRunAt} is the slot of the occurrence currently
 * materialized in the job table and only ever moves forward.
 */
public record RecurringSchedule(
    String scheduleId,
    String jobType,
    byte[] payload,
    int priority,
    int weight,
    int maxRetries,
    String cadence,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt) {

  public RecurringSchedule {
    Objects.requireNonNull(scheduleId, "scheduleId");
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(cadence, "cadence");
    Objects.requireNonNull(nextRunAt, "nextRunAt");
  }
}
