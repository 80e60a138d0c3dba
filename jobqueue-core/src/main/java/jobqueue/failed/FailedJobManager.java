package jobqueue.failed;

import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.spi.StoreException;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administrative access to jobs that ended {@code FAILED}: list them, count them and put them
 * back in the queue.
 *
 * <p>Re-queueing is deliberately outside the worker state machine: the job returns to
 * {@code PENDING} with {@code run_at} set to now and its retry ceiling raised by the original
 * budget, so it gets a fresh set of attempts while the attempt counter keeps growing. Recurring occurrences can be re-queued too; they do not move their
 * schedule again.
 */
public final class FailedJobManager {
  private static final Logger logger = Logger.getLogger(FailedJobManager.class.getName());

  private final JobLedger ledger;

  public FailedJobManager(JobLedger ledger) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
  }

  /**
   * Lists failed jobs, oldest first.
   *
   * @param jobType optional job type filter ({@code null} for all)
   * @param limit   maximum number of jobs to return
   * @return the failed jobs, empty if the store could not be read
   */
  public List<Job> query(String jobType, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try {
      return ledger.findByState(JobState.FAILED, jobType, limit);
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to query failed jobs", e);
      return List.of();
    }
  }

  /**
   * Re-queues one failed job.
   *
   * @param jobId the job id
   * @return {@code true} if the job was failed and is pending again
   */
  public boolean retry(long jobId) {
    try {
      boolean requeued = ledger.requeueFailed(jobId);
      if (requeued) {
        logger.log(Level.INFO, "Re-queued failed job {0}", jobId);
      }
      return requeued;
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to re-queue failed job " + jobId, e);
      return false;
    }
  }

  /**
   * Re-queues every failed job matching the filter, one batch at a time.
   *
   * @param jobType   optional job type filter ({@code null} for all)
   * @param batchSize number of jobs per batch
   * @return the number of jobs re-queued
   */
  public int retryAll(String jobType, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<Job> batch;
    do {
      try {
        batch = ledger.findByState(JobState.FAILED, jobType, batchSize);
      } catch (StoreException e) {
        logger.log(Level.SEVERE, "Failed to read failed jobs batch", e);
        break;
      }
      int requeued = 0;
      for (Job job : batch) {
        if (retry(job.id())) {
          requeued++;
        }
      }
      total += requeued;
      if (requeued == 0) {
        // Nothing moved; another batch would return the same rows
        break;
      }
    } while (batch.size() >= batchSize);
    return total;
  }

  /**
   * Counts failed jobs.
   *
   * @param jobType optional job type filter ({@code null} for all)
   * @return the number of failed jobs, 0 if the store could not be read
   */
  public int count(String jobType) {
    try {
      return ledger.countByState(JobState.FAILED, jobType);
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to count failed jobs", e);
      return 0;
    }
  }
}
