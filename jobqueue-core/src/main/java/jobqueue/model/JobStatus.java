package jobqueue.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Caller-facing snapshot of a job returned by {@link jobqueue.JobQueue#getStatus(long)}.
 */
public record JobStatus(
    long id,
    String jobType,
    JobState state,
    int attempt,
    int maxRetries,
    int priority,
    byte[] checkpoint,
    Instant runAt,
    Instant origRunAt,
    String lastError,
    List<RunInfo> runs,
    Instant createdAt,
    Instant updatedAt) {

  public JobStatus {
    runs = List.copyOf(runs);
  }

  public Optional<byte[]> checkpointIfPresent() {
    return Optional.ofNullable(checkpoint);
  }

  /**
   * Builds a status view from a job row and its run history.
   *
   * @param job  the job row
   * @param runs attempts ordered by attempt number
   * @return the status snapshot
   */
  public static JobStatus from(Job job, List<RunInfo> runs) {
    return new JobStatus(job.id(), job.jobType(), job.state(), job.attempt(), job.maxRetries(),
        job.priority(), job.checkpoint(), job.runAt(), job.origRunAt(), job.lastError(), runs,
        job.createdAt(), job.updatedAt());
  }
}
