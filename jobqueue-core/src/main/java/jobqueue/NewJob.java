package jobqueue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable enqueue request.
 *
 * <p>Only {@code jobType} is required. Unset {@code runAt} means "now", a {@code runAfter} delay
 * counts from the queue clock's "now", and unset {@code maxRetries} means the queue's configured
 * default. All three are resolved at insert time.
 *
 * <pre>{@code
 * long id = queue.enqueue(NewJob.builder("send-email")
 *     .payload(bytes)
 *     .priority(10)
 *     .runAfter(Duration.ofMinutes(5))
 *     .maxRetries(5)
 *     .build());
 * }</pre>
 */
public final class NewJob {
  private static final byte[] EMPTY = new byte[0];

  private final String jobType;
  private final byte[] payload;
  private final int priority;
  private final int weight;
  private final Instant runAt;
  private final Duration delay;
  private final Integer maxRetries;
  private final String recurringRef;
  private final Instant occurrenceAt;

  private NewJob(Builder builder) {
    if (builder.jobType == null || builder.jobType.isBlank()) {
      throw new JobValidationException("jobType must not be empty");
    }
    if (builder.weight < 1) {
      throw new JobValidationException("weight must be >= 1, got: " + builder.weight);
    }
    if (builder.maxRetries != null && builder.maxRetries < 0) {
      throw new JobValidationException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    if ((builder.recurringRef == null) != (builder.occurrenceAt == null)) {
      throw new JobValidationException("recurringRef and occurrenceAt must be set together");
    }
    this.jobType = builder.jobType;
    this.payload = builder.payload == null ? EMPTY : builder.payload.clone();
    this.priority = builder.priority;
    this.weight = builder.weight;
    this.runAt = builder.runAt;
    this.delay = builder.delay;
    this.maxRetries = builder.maxRetries;
    this.recurringRef = builder.recurringRef;
    this.occurrenceAt = builder.occurrenceAt;
  }

  public static Builder builder(String jobType) {
    return new Builder(jobType);
  }

  public String jobType() {
    return jobType;
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

  /** Requested run time, or {@code null} for "as soon as possible". */
  public Instant runAt() {
    return runAt;
  }

  /** Requested delay relative to the insert time, or {@code null}. Ignored once resolved. */
  public Duration delay() {
    return delay;
  }

  /** Requested retry ceiling, or {@code null} for the queue default. */
  public Integer maxRetries() {
    return maxRetries;
  }

  public String recurringRef() {
    return recurringRef;
  }

  public Instant occurrenceAt() {
    return occurrenceAt;
  }

  /**
   * Returns a copy with {@code runAt} and {@code maxRetries} filled in where unset.
   *
   * @param now               the insert time
   * @param defaultMaxRetries retry ceiling used when none was requested
   * @return a fully resolved request
   */
  public NewJob resolve(Instant now, int defaultMaxRetries) {
    if (runAt != null && maxRetries != null) {
      return this;
    }
    Builder copy = toBuilder();
    copy.runAt = runAt != null ? runAt : delay != null ? now.plus(delay) : now;
    copy.delay = null;
    copy.maxRetries = maxRetries != null ? maxRetries : defaultMaxRetries;
    return copy.build();
  }

  public Builder toBuilder() {
    Builder b = new Builder(jobType);
    b.payload = payload;
    b.priority = priority;
    b.weight = weight;
    b.runAt = runAt;
    b.delay = delay;
    b.maxRetries = maxRetries;
    b.recurringRef = recurringRef;
    b.occurrenceAt = occurrenceAt;
    return b;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NewJob other)) return false;
    return priority == other.priority
        && weight == other.weight
        && jobType.equals(other.jobType)
        && Arrays.equals(payload, other.payload)
        && Objects.equals(runAt, other.runAt)
        && Objects.equals(delay, other.delay)
        && Objects.equals(maxRetries, other.maxRetries)
        && Objects.equals(recurringRef, other.recurringRef)
        && Objects.equals(occurrenceAt, other.occurrenceAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(jobType, priority, weight, runAt, delay, maxRetries, recurringRef, occurrenceAt);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "NewJob{jobType=" + jobType + ", priority=" + priority + ", runAt=" + runAt
        + ", recurringRef=" + recurringRef + "}";
  }

  /** Builder for {@link NewJob}. */
  public static final class Builder {
    private final String jobType;
    private byte[] payload;
    private int priority;
    private int weight = 1;
    private Instant runAt;
    private Duration delay;
    private Integer maxRetries;
    private String recurringRef;
    private Instant occurrenceAt;

    private Builder(String jobType) {
      this.jobType = jobType;
    }

    /**
     * Sets the opaque payload handed to the handler.
     *
     * <p>Optional. Defaults to an empty array.
     *
     * @param payload payload bytes (copied)
     * @return this builder
     */
    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets the claim priority. Higher values are claimed first.
     *
     * <p>Optional. Defaults to {@code 0}. Negative values are allowed.
     *
     * @param priority the priority
     * @return this builder
     */
    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Sets how many worker slots the job occupies while running.
     *
     * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
     *
     * @param weight concurrency weight
     * @return this builder
     */
    public Builder weight(int weight) {
      this.weight = weight;
      return this;
    }

    /**
     * Sets the earliest time the job may be claimed.
     *
     * <p>Optional. Defaults to the enqueue time. Replaces an earlier {@link #runAfter(Duration)}.
     *
     * @param runAt earliest claim time
     * @return this builder
     */
    public Builder runAt(Instant runAt) {
      this.runAt = runAt;
      this.delay = null;
      return this;
    }

    /**
     * Delays the job relative to its insert time, as read from the queue's clock. Replaces an
     * earlier {@link #runAt(Instant)}.
     *
     * @param delay delay from now; must not be negative
     * @return this builder
     */
    public Builder runAfter(Duration delay) {
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative()) {
        throw new JobValidationException("delay must not be negative");
      }
      this.delay = delay;
      this.runAt = null;
      return this;
    }

    /**
     * Sets how many times a failed job is retried before it is marked FAILED.
     *
     * <p>Optional. Defaults to the queue's configured default. Must be &ge; 0.
     *
     * @param maxRetries retry ceiling
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Links the job to a recurring schedule occurrence. Used by the recurrence engine; callers
     * enqueuing manually must reference an existing schedule.
     *
     * @param scheduleId   the schedule id
     * @param occurrenceAt the cadence slot this job fills
     * @return this builder
     */
    public Builder recurrence(String scheduleId, Instant occurrenceAt) {
      this.recurringRef = scheduleId;
      this.occurrenceAt = occurrenceAt;
      return this;
    }

    /**
     * Builds the request.
     *
     * @return a new {@link NewJob}
     * @throws JobValidationException if {@code jobType} is blank, {@code weight < 1},
     *     {@code maxRetries < 0}, or only one of the recurrence fields is set
     */
    public NewJob build() {
      return new NewJob(this);
    }
  }
}
