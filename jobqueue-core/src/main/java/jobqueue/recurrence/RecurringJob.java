package jobqueue.recurrence;

import jobqueue.JobValidationException;

import java.time.Instant;
import java.util.Objects;

/**
 * Registration request for a recurring schedule.
 *
 * <pre>{@code
 * String id = queue.registerRecurring(RecurringJob.builder("nightly-report", "0 2 * * *")
 *     .scheduleId("nightly-report")
 *     .priority(5)
 *     .build());
 * }</pre>
 */
public final class RecurringJob {
  private static final byte[] EMPTY = new byte[0];

  private final String scheduleId;
  private final String jobType;
  private final String cadence;
  private final byte[] payload;
  private final int priority;
  private final int weight;
  private final Integer maxRetries;
  private final Instant firstRunAt;

  private RecurringJob(Builder builder) {
    if (builder.jobType == null || builder.jobType.isBlank()) {
      throw new JobValidationException("jobType must not be empty");
    }
    if (builder.cadence == null || builder.cadence.isBlank()) {
      throw new JobValidationException("cadence must not be empty");
    }
    if (builder.scheduleId != null && builder.scheduleId.isBlank()) {
      throw new JobValidationException("scheduleId must not be blank");
    }
    if (builder.weight < 1) {
      throw new JobValidationException("weight must be >= 1, got: " + builder.weight);
    }
    if (builder.maxRetries != null && builder.maxRetries < 0) {
      throw new JobValidationException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    this.scheduleId = builder.scheduleId;
    this.jobType = builder.jobType;
    this.cadence = builder.cadence.trim();
    this.payload = builder.payload == null ? EMPTY : builder.payload.clone();
    this.priority = builder.priority;
    this.weight = builder.weight;
    this.maxRetries = builder.maxRetries;
    this.firstRunAt = builder.firstRunAt;
  }

  public static Builder builder(String jobType, String cadence) {
    return new Builder(jobType, cadence);
  }

  /** Caller-chosen schedule id, or {@code null} to generate one. */
  public String scheduleId() {
    return scheduleId;
  }

  public String jobType() {
    return jobType;
  }

  public String cadence() {
    return cadence;
  }

  public byte[] payload() {
    return payload.clone();
  }

  public int priority() {
    return priority;
  }

  public int weight() {
    return weight;
  }

  /** Retry budget per occurrence, or {@code null} for the queue default. */
  public Integer maxRetries() {
    return maxRetries;
  }

  /** Slot of the first occurrence, or {@code null} for the cadence's first slot after now. */
  public Instant firstRunAt() {
    return firstRunAt;
  }

  /** Builder for {@link RecurringJob}. */
  public static final class Builder {
    private final String jobType;
    private final String cadence;
    private String scheduleId;
    private byte[] payload;
    private int priority;
    private int weight = 1;
    private Integer maxRetries;
    private Instant firstRunAt;

    private Builder(String jobType, String cadence) {
      this.jobType = jobType;
      this.cadence = cadence;
    }

    /**
     * Sets a stable schedule id. Registering the same id again is a no-op, which makes
     * registration at application startup safe.
     *
     * <p>Optional. Defaults to a generated ULID.
     */
    public Builder scheduleId(String scheduleId) {
      this.scheduleId = scheduleId;
      return this;
    }

    /** Payload copied into every occurrence. */
    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder weight(int weight) {
      this.weight = weight;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder firstRunAt(Instant firstRunAt) {
      this.firstRunAt = Objects.requireNonNull(firstRunAt, "firstRunAt");
      return this;
    }

    /**
     * Builds the request.
     *
     * @throws JobValidationException if a field is missing or out of range
     */
    public RecurringJob build() {
      return new RecurringJob(this);
    }
  }
}
