package jobqueue.jdbc;

import jobqueue.NewJob;
import jobqueue.StateConflictException;
import jobqueue.claim.ClaimProtocol;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.model.RecurringSchedule;
import jobqueue.model.RunInfo;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Job store behavior against real databases. Subclasses provide the DataSource and store,
 * create the schema once and empty the tables before each test.
 */
abstract class AbstractJobStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract AbstractJdbcJobStore store();

  private JobLedger ledger() {
    return new JobLedger(new DataSourceConnectionProvider(dataSource()), store());
  }

  @Test
  void insertReadAndClaim() {
    JobLedger ledger = ledger();
    long id = ledger.insertJob(NewJob.builder("ingest")
        .payload("{\"file\":\"a.csv\"}".getBytes(StandardCharsets.UTF_8))
        .priority(3)
        .maxRetries(2)
        .runAt(Instant.now().minusSeconds(1))
        .build());

    Job pending = ledger.readJob(id);
    assertEquals(JobState.PENDING, pending.state());
    assertEquals("{\"file\":\"a.csv\"}", new String(pending.payload(), StandardCharsets.UTF_8));

    Job claimed = ClaimProtocol.builder().ledger(ledger).build().claim().orElseThrow();
    assertEquals(id, claimed.id());
    assertEquals(1, claimed.attempt());
    assertNotNull(claimed.heartbeatAt());

    ledger.transition(id, JobState.RUNNING, JobTransition.succeed(1));
    List<RunInfo> runs = ledger.runs(id);
    assertEquals(1, runs.size());
    assertEquals(Boolean.TRUE, runs.get(0).success());
  }

  @Test
  void claimOrderFollowsPriorityAndRunAt() {
    JobLedger ledger = ledger();
    Instant base = Instant.now().minusSeconds(60).truncatedTo(ChronoUnit.MILLIS);
    long older = ledger.insertJob(NewJob.builder("t").runAt(base).build());
    long newer = ledger.insertJob(NewJob.builder("t").runAt(base.plusSeconds(10)).build());
    long urgent = ledger.insertJob(NewJob.builder("t").priority(5).runAt(base.plusSeconds(20)).build());
    ledger.insertJob(NewJob.builder("t").runAt(Instant.now().plusSeconds(3600)).build());

    ClaimProtocol claims = ClaimProtocol.builder().ledger(ledger).build();
    List<Long> order = new ArrayList<>();
    Optional<Job> next;
    while ((next = claims.claim()).isPresent()) {
      order.add(next.get().id());
    }

    assertEquals(List.of(urgent, older, newer), order);
  }

  @Test
  void concurrentClaimersGetDistinctJobs() throws Exception {
    JobLedger ledger = ledger();
    int jobs = 30;
    for (int i = 0; i < jobs; i++) {
      ledger.insertJob(NewJob.builder("parallel").runAt(Instant.now().minusSeconds(1)).build());
    }

    Set<Long> claimed = ConcurrentHashMap.newKeySet();
    List<Long> duplicates = new ArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    CountDownLatch go = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < 4; t++) {
      futures.add(executor.submit(() -> {
        ClaimProtocol claims = ClaimProtocol.builder().ledger(ledger).build();
        go.await();
        Optional<Job> job;
        while ((job = claims.claim()).isPresent()) {
          if (!claimed.add(job.get().id())) {
            synchronized (duplicates) {
              duplicates.add(job.get().id());
            }
          }
        }
        return null;
      }));
    }
    go.countDown();
    for (Future<?> f : futures) {
      f.get(60, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertTrue(duplicates.isEmpty(), "claimed twice: " + duplicates);
    assertEquals(jobs, claimed.size());
    assertEquals(jobs, ledger.countByState(JobState.RUNNING, "parallel"));
  }

  @Test
  void checkpointHeartbeatAndCancelFlag() {
    JobLedger ledger = ledger();
    long id = ledger.insertJob(NewJob.builder("t").runAt(Instant.now().minusSeconds(1)).build());
    ClaimProtocol.builder().ledger(ledger).build().claim().orElseThrow();

    ledger.writeCheckpoint(id, 1, new byte[]{1, 2, 3});
    assertTrue(ledger.heartbeat(id, 1));
    assertFalse(ledger.heartbeat(id, 7));
    assertTrue(ledger.requestCancel(id));

    Job running = ledger.readJob(id);
    assertArrayEquals(new byte[]{1, 2, 3}, running.checkpoint());
    assertTrue(running.cancelRequested());

    Job retried = ledger.transition(id, JobState.RUNNING,
        JobTransition.retry(1, Instant.now().plusSeconds(30), "JobCancelledException"));
    assertFalse(retried.cancelRequested());
    assertArrayEquals(new byte[]{1, 2, 3}, retried.checkpoint());
  }

  @Test
  void staleJobsAreFoundAndRecoveredOnce() {
    JobLedger ledger = ledger();
    long id = ledger.insertJob(NewJob.builder("t").runAt(Instant.now().minusSeconds(1)).build());
    ClaimProtocol.builder().ledger(ledger).build().claim().orElseThrow();
    Instant cutoff = Instant.now().plusSeconds(1);

    List<Job> stale = ledger.findStaleRunning(cutoff, 10);
    assertEquals(1, stale.size());

    ledger.transition(id, JobState.RUNNING, JobTransition.recover(1, Instant.now(), cutoff));
    assertThrows(StateConflictException.class,
        () -> ledger.transition(id, JobState.RUNNING, JobTransition.recover(1, Instant.now(), cutoff)));
    assertEquals(JobState.PENDING, ledger.readJob(id).state());
    assertEquals(Boolean.FALSE, ledger.runs(id).get(0).success());
  }

  @Test
  void requeueFailedAndCounts() {
    JobLedger ledger = ledger();
    long id = ledger.insertJob(NewJob.builder("t").maxRetries(0).runAt(Instant.now().minusSeconds(1)).build());
    ClaimProtocol.builder().ledger(ledger).build().claim().orElseThrow();
    ledger.transition(id, JobState.RUNNING, JobTransition.fail(1, "boom"));

    assertEquals(1, ledger.countByState(JobState.FAILED, "t"));
    assertEquals(1, ledger.findByState(JobState.FAILED, null, 10).size());
    assertTrue(ledger.requeueFailed(id));

    Job requeued = ledger.readJob(id);
    assertEquals(JobState.PENDING, requeued.state());
    assertEquals(1, requeued.maxRetries());
  }

  @Test
  void schedulesAndOccurrences() {
    JobLedger ledger = ledger();
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    Instant slot = now.plus(Duration.ofHours(1));
    RecurringSchedule schedule = new RecurringSchedule("sync", "sync", new byte[0], 1, 1, 3,
        "1h", slot, now, now);

    assertTrue(ledger.insertSchedule(schedule,
        NewJob.builder("sync").recurrence("sync", slot).runAt(slot).build()));
    assertFalse(ledger.insertOccurrenceIfAbsent(
        NewJob.builder("sync").recurrence("sync", slot).runAt(slot).build()));
    assertTrue(ledger.findOccurrence("sync", slot).isPresent());

    Instant next = slot.plus(Duration.ofHours(1));
    assertTrue(ledger.advanceSchedule("sync", slot, next));
    assertFalse(ledger.advanceSchedule("sync", slot, next.plus(Duration.ofHours(1))));
    assertEquals(next, ledger.readSchedule("sync").nextRunAt());
  }
}
