package jobqueue.claim;

import jobqueue.JobNotFoundException;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.spi.JobStore;
import jobqueue.spi.StoreException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Atomically hands the best-ranked ready job to exactly one caller.
 *
 * <p>One claim is one transaction: select the top candidate
 * ({@code priority DESC, run_at ASC, id ASC} among {@code PENDING} jobs with
 * {@code run_at <= now}), apply the guarded {@code PENDING -> RUNNING} transition which bumps
 * {@code attempt} and stamps {@code heartbeat_at}, open the attempt's run-history entry and
 * commit. If the guard matches no row another claimer won the race, and selection is repeated.
 *
 * <p>Transient store failures are retried with a doubling backoff up to
 * {@link Builder#maxTransientRetries(int)} times; fatal ones propagate.
 */
public final class ClaimProtocol {
  private static final Logger logger = Logger.getLogger(ClaimProtocol.class.getName());

  private static final int MAX_LOST_RACES = 16;

  private final JobLedger ledger;
  private final int maxTransientRetries;
  private final long transientBackoffMs;

  private ClaimProtocol(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    if (builder.maxTransientRetries < 0) {
      throw new IllegalArgumentException("maxTransientRetries must be >= 0");
    }
    if (builder.transientBackoffMs < 0) {
      throw new IllegalArgumentException("transientBackoffMs must be >= 0");
    }
    this.maxTransientRetries = builder.maxTransientRetries;
    this.transientBackoffMs = builder.transientBackoffMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Claims the next ready job of any type.
   *
   * @return the claimed job in {@code RUNNING} state, or empty if nothing is ready
   */
  public Optional<Job> claim() {
    return claim(Set.of(), Integer.MAX_VALUE);
  }

  /**
   * Claims the next ready job.
   *
   * @param jobTypes  job types to consider; empty for all
   * @param maxWeight only jobs with {@code weight <= maxWeight} qualify
   * @return the claimed job in {@code RUNNING} state, or empty if nothing is ready
   * @throws StoreException if the store fails fatally, or transiently more often than allowed
   */
  public Optional<Job> claim(Set<String> jobTypes, int maxWeight) {
    Objects.requireNonNull(jobTypes, "jobTypes");
    if (maxWeight < 1) {
      return Optional.empty();
    }
    int transientFailures = 0;
    int lostRaces = 0;
    while (true) {
      try {
        Attempt attempt = tryClaim(jobTypes, maxWeight);
        if (!attempt.lost()) {
          return Optional.ofNullable(attempt.job());
        }
        if (++lostRaces >= MAX_LOST_RACES) {
          // Heavy contention; let the caller back off instead of spinning here
          logger.log(Level.FINE, "Gave up claiming after {0} lost races", lostRaces);
          return Optional.empty();
        }
      } catch (StoreException e) {
        if (!e.isTransient() || transientFailures >= maxTransientRetries) {
          throw e;
        }
        transientFailures++;
        logger.log(Level.FINE, "Transient store failure during claim, retry " + transientFailures, e);
        sleepBackoff(transientFailures);
      }
    }
  }

  private Attempt tryClaim(Set<String> jobTypes, int maxWeight) {
    return ledger.inTransaction("claim job", conn -> {
      JobStore store = ledger.store();
      Instant now = ledger.now();
      Optional<Job> candidate = store.selectNextReady(conn, now, jobTypes, maxWeight);
      if (candidate.isEmpty()) {
        return Attempt.NONE;
      }
      long id = candidate.get().id();
      if (store.transition(conn, id, JobState.PENDING, JobTransition.claim(), now) == 0) {
        return Attempt.LOST;
      }
      Job claimed = store.findJob(conn, id).orElseThrow(() -> JobNotFoundException.job(id));
      store.insertRun(conn, id, claimed.attempt(), now);
      return new Attempt(claimed, false);
    });
  }

  private void sleepBackoff(int failures) {
    long delay = transientBackoffMs << Math.min(failures - 1, 10);
    if (delay <= 0) {
      return;
    }
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreException("Interrupted while backing off a claim", e, false);
    }
  }

  private record Attempt(Job job, boolean lost) {
    static final Attempt NONE = new Attempt(null, false);
    static final Attempt LOST = new Attempt(null, true);
  }

  /** Builder for {@link ClaimProtocol}. */
  public static final class Builder {
    private JobLedger ledger;
    private int maxTransientRetries = 5;
    private long transientBackoffMs = 10;

    private Builder() {}

    /**
     * Sets the ledger whose store and clock are used for claims.
     *
     * <p><b>Required.</b>
     *
     * @param ledger the job ledger
     * @return this builder
     */
    public Builder ledger(JobLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Sets how many times a transient store failure is retried within one claim.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 0.
     *
     * @param maxTransientRetries retry limit
     * @return this builder
     */
    public Builder maxTransientRetries(int maxTransientRetries) {
      this.maxTransientRetries = maxTransientRetries;
      return this;
    }

    /**
     * Sets the initial backoff between transient retries; it doubles on each retry.
     *
     * <p>Optional. Defaults to {@code 10} ms. Must be &ge; 0.
     *
     * @param transientBackoffMs initial backoff in milliseconds
     * @return this builder
     */
    public Builder transientBackoffMs(long transientBackoffMs) {
      this.transientBackoffMs = transientBackoffMs;
      return this;
    }

    /**
     * Builds the claim protocol.
     *
     * @return a new {@link ClaimProtocol}
     * @throws NullPointerException     if {@code ledger} is null
     * @throws IllegalArgumentException if a limit is negative
     */
    public ClaimProtocol build() {
      return new ClaimProtocol(this);
    }
  }
}
