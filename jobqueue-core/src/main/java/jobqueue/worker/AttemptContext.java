package jobqueue.worker;

import jobqueue.StateConflictException;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** {@link JobContext} bound to one claimed attempt. */
final class AttemptContext implements JobContext {
  private final JobLedger ledger;
  private final Job job;
  private final AtomicBoolean cancelRequested;
  private volatile byte[] latestCheckpoint;

  AttemptContext(JobLedger ledger, Job job, AtomicBoolean cancelRequested) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.job = Objects.requireNonNull(job, "job");
    this.cancelRequested = Objects.requireNonNull(cancelRequested, "cancelRequested");
    this.latestCheckpoint = job.checkpoint();
  }

  @Override
  public long jobId() {
    return job.id();
  }

  @Override
  public String jobType() {
    return job.jobType();
  }

  @Override
  public byte[] payload() {
    byte[] payload = job.payload();
    return payload == null ? new byte[0] : payload.clone();
  }

  @Override
  public int attempt() {
    return job.attempt();
  }

  @Override
  public int maxRetries() {
    return job.maxRetries();
  }

  @Override
  public Optional<byte[]> checkpoint() {
    byte[] current = latestCheckpoint;
    return current == null ? Optional.empty() : Optional.of(current.clone());
  }

  @Override
  public void checkpoint(byte[] checkpoint) {
    Objects.requireNonNull(checkpoint, "checkpoint");
    byte[] copy = checkpoint.clone();
    ledger.writeCheckpoint(job.id(), job.attempt(), copy);
    latestCheckpoint = copy;
  }

  @Override
  public void heartbeat() {
    if (!ledger.heartbeat(job.id(), job.attempt())) {
      JobState actual = ledger.readJob(job.id()).state();
      throw new StateConflictException(job.id(), JobState.RUNNING, actual,
          StateConflictException.Reason.STATE_CHANGED);
    }
  }

  @Override
  public boolean isCancelRequested() {
    return cancelRequested.get();
  }
}
