package jobqueue.model;

import java.time.Instant;

/**
 * Persisted job row as read from the store.
 *
 * <p>{@code payload} and {@code checkpoint} are opaque to the queue. {@code occurrenceAt} is set
 * only on jobs materialized from a recurring schedule and doubles as their idempotency key.
 */
public record Job(
    long id,
    String jobType,
    byte[] payload,
    int priority,
    int weight,
    Instant runAt,
    Instant origRunAt,
    JobState state,
    int attempt,
    int maxRetries,
    byte[] checkpoint,
    Instant heartbeatAt,
    boolean cancelRequested,
    String recurringRef,
    Instant occurrenceAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isRecurring() {
    return recurringRef != null;
  }
}
