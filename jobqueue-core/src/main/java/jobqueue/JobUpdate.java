package jobqueue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fields to change on a pending job via {@link JobQueue#modify(long, JobUpdate)}. Unset fields
 * are left untouched.
 */
public final class JobUpdate {
  private final byte[] payload;
  private final Integer priority;
  private final Instant runAt;
  private final Integer maxRetries;
  private final Integer weight;

  private JobUpdate(Builder builder) {
    if (builder.maxRetries != null && builder.maxRetries < 0) {
      throw new JobValidationException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    if (builder.weight != null && builder.weight < 1) {
      throw new JobValidationException("weight must be >= 1, got: " + builder.weight);
    }
    this.payload = builder.payload == null ? null : builder.payload.clone();
    this.priority = builder.priority;
    this.runAt = builder.runAt;
    this.maxRetries = builder.maxRetries;
    this.weight = builder.weight;
    if (isEmpty()) {
      throw new JobValidationException("JobUpdate must change at least one field");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public byte[] payload() {
    return payload == null ? null : payload.clone();
  }

  public Integer priority() {
    return priority;
  }

  public Instant runAt() {
    return runAt;
  }

  public Integer maxRetries() {
    return maxRetries;
  }

  public Integer weight() {
    return weight;
  }

  private boolean isEmpty() {
    return payload == null && priority == null && runAt == null && maxRetries == null && weight == null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof JobUpdate other)) return false;
    return Arrays.equals(payload, other.payload)
        && Objects.equals(priority, other.priority)
        && Objects.equals(runAt, other.runAt)
        && Objects.equals(maxRetries, other.maxRetries)
        && Objects.equals(weight, other.weight);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(priority, runAt, maxRetries, weight) + Arrays.hashCode(payload);
  }

  /** Builder for {@link JobUpdate}. */
  public static final class Builder {
    private byte[] payload;
    private Integer priority;
    private Instant runAt;
    private Integer maxRetries;
    private Integer weight;

    private Builder() {}

    public Builder payload(byte[] payload) {
      this.payload = payload;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder runAt(Instant runAt) {
      this.runAt = runAt;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder weight(int weight) {
      this.weight = weight;
      return this;
    }

    /**
     * Builds the update.
     *
     * @return a new {@link JobUpdate}
     * @throws JobValidationException if no field is set or a value is out of range
     */
    public JobUpdate build() {
      return new JobUpdate(this);
    }
  }
}
