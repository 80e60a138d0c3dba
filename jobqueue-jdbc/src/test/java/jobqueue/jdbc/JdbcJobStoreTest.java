package jobqueue.jdbc;

import jobqueue.JobUpdate;
import jobqueue.NewJob;
import jobqueue.StateConflictException;
import jobqueue.claim.ClaimProtocol;
import jobqueue.jdbc.store.H2JobStore;
import jobqueue.ledger.JobLedger;
import jobqueue.model.Job;
import jobqueue.model.JobState;
import jobqueue.model.JobTransition;
import jobqueue.model.RecurringSchedule;
import jobqueue.model.RunInfo;
import jobqueue.spi.StoreException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final MutableClock clock = new MutableClock(T0);
  private JdbcDataSource dataSource;
  private H2JobStore store;
  private JobLedger ledger;
  private ClaimProtocol claims;

  @BeforeEach
  void setup() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:store_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    store = new H2JobStore();
    JdbcSchema.create(dataSource, store);
    ledger = new JobLedger(new DataSourceConnectionProvider(dataSource), store, clock, 3);
    claims = ClaimProtocol.builder().ledger(ledger).build();
  }

  @Test
  void insertedJobRoundTripsEveryField() {
    long id = ledger.insertJob(NewJob.builder("resize")
        .payload(bytes("img-42"))
        .priority(7)
        .weight(2)
        .runAt(T0.plusMillis(1500).plusNanos(999))
        .maxRetries(5)
        .build());

    Job job = ledger.readJob(id);
    assertEquals("resize", job.jobType());
    assertArrayEquals(bytes("img-42"), job.payload());
    assertEquals(7, job.priority());
    assertEquals(2, job.weight());
    assertEquals(T0.plusMillis(1500), job.runAt());
    assertEquals(T0.plusMillis(1500), job.origRunAt());
    assertEquals(JobState.PENDING, job.state());
    assertEquals(0, job.attempt());
    assertEquals(5, job.maxRetries());
    assertNull(job.checkpoint());
    assertNull(job.heartbeatAt());
    assertFalse(job.cancelRequested());
    assertNull(job.recurringRef());
    assertEquals(T0, job.createdAt());
  }

  @Test
  void idsIncrease() {
    long first = ledger.insertJob(NewJob.builder("a").build());
    long second = ledger.insertJob(NewJob.builder("a").build());

    assertTrue(second > first);
  }

  @Test
  void selectsByPriorityThenRunAtThenId() throws Exception {
    long late = ledger.insertJob(NewJob.builder("t").runAt(T0.minusSeconds(10)).build());
    long early = ledger.insertJob(NewJob.builder("t").runAt(T0.minusSeconds(20)).build());
    long urgent = ledger.insertJob(NewJob.builder("t").priority(9).runAt(T0.minusSeconds(5)).build());
    long sameTime = ledger.insertJob(NewJob.builder("t").runAt(T0.minusSeconds(20)).build());

    assertEquals(List.of(urgent, early, sameTime, late), claimAll());
  }

  @Test
  void futureJobsAreNotSelected() throws Exception {
    ledger.insertJob(NewJob.builder("t").runAt(T0.plusSeconds(1)).build());

    try (Connection conn = dataSource.getConnection()) {
      assertTrue(store.selectNextReady(conn, T0, Set.of(), Integer.MAX_VALUE).isEmpty());
      assertTrue(store.selectNextReady(conn, T0.plusSeconds(1), Set.of(), Integer.MAX_VALUE).isPresent());
    }
  }

  @Test
  void selectionFiltersByTypeAndWeight() throws Exception {
    long heavy = ledger.insertJob(NewJob.builder("video").weight(3).build());
    long light = ledger.insertJob(NewJob.builder("email").build());

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(light, store.selectNextReady(conn, T0, Set.of(), 2).orElseThrow().id());
      assertEquals(heavy, store.selectNextReady(conn, T0, Set.of("video", "audio"), 3).orElseThrow().id());
      assertTrue(store.selectNextReady(conn, T0, Set.of("video"), 2).isEmpty());
    }
  }

  @Test
  void claimStampsAttemptHeartbeatAndRunHistory() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    clock.advance(Duration.ofSeconds(3));

    Job claimed = claims.claim().orElseThrow();

    assertEquals(id, claimed.id());
    assertEquals(JobState.RUNNING, claimed.state());
    assertEquals(1, claimed.attempt());
    assertEquals(T0.plusSeconds(3), claimed.heartbeatAt());
    List<RunInfo> runs = ledger.runs(id);
    assertEquals(1, runs.size());
    assertEquals(1, runs.get(0).attempt());
    assertEquals(T0.plusSeconds(3), runs.get(0).startedAt());
    assertNull(runs.get(0).finishedAt());
    assertNull(runs.get(0).success());
  }

  @Test
  void transitionIsGuardedOnStateAndAttempt() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();

    assertThrows(StateConflictException.class,
        () -> ledger.transition(id, JobState.RUNNING, JobTransition.succeed(2)));
    assertThrows(StateConflictException.class,
        () -> ledger.transition(id, JobState.PENDING, JobTransition.claim()));

    Job done = ledger.transition(id, JobState.RUNNING, JobTransition.succeed(1));
    assertEquals(JobState.SUCCEEDED, done.state());
    RunInfo run = ledger.runs(id).get(0);
    assertEquals(Boolean.TRUE, run.success());
    assertNotNull(run.finishedAt());
  }

  @Test
  void retryRecordsErrorAndNewRunTime() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();

    Job retried = ledger.transition(id, JobState.RUNNING,
        JobTransition.retry(1, T0.plusSeconds(20), "IOException: timeout"));

    assertEquals(JobState.PENDING, retried.state());
    assertEquals(T0.plusSeconds(20), retried.runAt());
    assertEquals(T0, retried.origRunAt());
    assertEquals("IOException: timeout", retried.lastError());
    RunInfo run = ledger.runs(id).get(0);
    assertEquals(Boolean.FALSE, run.success());
    assertEquals("IOException: timeout", run.info());
  }

  @Test
  void longErrorsAreTruncated() {
    long id = ledger.insertJob(NewJob.builder("t").maxRetries(0).build());
    claims.claim().orElseThrow();

    Job failed = ledger.transition(id, JobState.RUNNING, JobTransition.fail(1, "x".repeat(10_000)));

    assertEquals(4000, failed.lastError().length());
    assertTrue(failed.lastError().endsWith("..."));
  }

  @Test
  void checkpointAndHeartbeatRequireTheOwningAttempt() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();
    clock.advance(Duration.ofSeconds(30));

    ledger.writeCheckpoint(id, 1, bytes("page-3"));
    assertTrue(ledger.heartbeat(id, 1));
    assertFalse(ledger.heartbeat(id, 2));
    assertThrows(StateConflictException.class, () -> ledger.writeCheckpoint(id, 2, bytes("stale")));

    Job job = ledger.readJob(id);
    assertArrayEquals(bytes("page-3"), job.checkpoint());
    assertEquals(T0.plusSeconds(30), job.heartbeatAt());
  }

  @Test
  void checkpointSurvivesRetry() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();
    ledger.writeCheckpoint(id, 1, bytes("row-500"));
    ledger.transition(id, JobState.RUNNING, JobTransition.retry(1, T0, "boom"));

    Job second = claims.claim().orElseThrow();

    assertEquals(2, second.attempt());
    assertArrayEquals(bytes("row-500"), second.checkpoint());
  }

  @Test
  void cancelFlagIsClearedWhenJobLeavesRunning() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    assertFalse(ledger.requestCancel(id));
    claims.claim().orElseThrow();

    assertTrue(ledger.requestCancel(id));
    assertTrue(ledger.readJob(id).cancelRequested());

    ledger.transition(id, JobState.RUNNING, JobTransition.retry(1, T0, "cancelled"));
    assertFalse(ledger.readJob(id).cancelRequested());
  }

  @Test
  void updateIfPendingChangesOnlyGivenFields() {
    long id = ledger.insertJob(NewJob.builder("t").payload(bytes("v1")).priority(1).build());

    ledger.modifyIfPending(id, JobUpdate.builder().priority(8).runAt(T0.plusSeconds(60)).build());

    Job job = ledger.readJob(id);
    assertEquals(8, job.priority());
    assertEquals(T0.plusSeconds(60), job.runAt());
    assertEquals(T0, job.origRunAt());
    assertArrayEquals(bytes("v1"), job.payload());
  }

  @Test
  void pendingOnlyOperationsReportActualState() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();

    StateConflictException e = assertThrows(StateConflictException.class,
        () -> ledger.modifyIfPending(id, JobUpdate.builder().priority(1).build()));
    assertEquals(JobState.RUNNING, e.actual());
    assertEquals(StateConflictException.Reason.NOT_PENDING, e.reason());
    assertThrows(StateConflictException.class, () -> ledger.cancelIfPending(id));
  }

  @Test
  void findsRunningJobsWithStaleHeartbeats() {
    long stale = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();
    clock.advance(Duration.ofMinutes(5));
    long fresh = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();

    List<Job> found = ledger.findStaleRunning(clock.instant().minus(Duration.ofMinutes(2)), 10);

    assertEquals(1, found.size());
    assertEquals(stale, found.get(0).id());
    assertNotEquals(stale, fresh);
  }

  @Test
  void recoverTransitionSkipsJobsWithFreshHeartbeat() {
    long id = ledger.insertJob(NewJob.builder("t").build());
    claims.claim().orElseThrow();
    Instant cutoff = T0.minusSeconds(1);

    assertThrows(StateConflictException.class, () ->
        ledger.transition(id, JobState.RUNNING, JobTransition.recover(1, T0, cutoff)));

    Job recovered = ledger.transition(id, JobState.RUNNING, JobTransition.recover(1, T0, T0.plusSeconds(1)));
    assertEquals(JobState.PENDING, recovered.state());
    assertEquals(1, recovered.attempt());
  }

  @Test
  void queriesAndCountsByState() {
    ledger.insertJob(NewJob.builder("a").build());
    ledger.insertJob(NewJob.builder("b").build());
    ledger.insertJob(NewJob.builder("b").build());

    assertEquals(3, ledger.countByState(JobState.PENDING, null));
    assertEquals(2, ledger.countByState(JobState.PENDING, "b"));
    assertEquals(0, ledger.countByState(JobState.FAILED, null));
    assertEquals(2, ledger.findByState(JobState.PENDING, null, 2).size());
    assertEquals(1, ledger.findByState(JobState.PENDING, "a", 10).size());
  }

  @Test
  void requeueFailedExtendsRetryBudget() {
    long id = ledger.insertJob(NewJob.builder("t").maxRetries(1).build());
    claims.claim().orElseThrow();
    ledger.transition(id, JobState.RUNNING, JobTransition.retry(1, T0, "e1"));
    claims.claim().orElseThrow();
    ledger.transition(id, JobState.RUNNING, JobTransition.fail(2, "e2"));
    clock.advance(Duration.ofHours(1));

    assertTrue(ledger.requeueFailed(id));
    assertFalse(ledger.requeueFailed(id));

    Job requeued = ledger.readJob(id);
    assertEquals(JobState.PENDING, requeued.state());
    assertEquals(2, requeued.attempt());
    assertEquals(3, requeued.maxRetries());
    assertEquals(clock.instant(), requeued.runAt());
    assertEquals(3, claims.claim().orElseThrow().attempt());
  }

  @Test
  void scheduleRoundTripAndGuardedAdvance() {
    RecurringSchedule schedule = new RecurringSchedule("nightly", "report", bytes("{}"), 2, 1, 4,
        "0 2 * * *", T0.plus(Duration.ofHours(16)), T0, T0);
    NewJob first = NewJob.builder("report").recurrence("nightly", schedule.nextRunAt())
        .runAt(schedule.nextRunAt()).build();

    assertTrue(ledger.insertSchedule(schedule, first));
    assertFalse(ledger.insertSchedule(schedule, first));

    RecurringSchedule read = ledger.readSchedule("nightly");
    assertEquals("0 2 * * *", read.cadence());
    assertEquals(T0.plus(Duration.ofHours(16)), read.nextRunAt());
    assertEquals(4, read.maxRetries());
    assertEquals(1, ledger.schedules().size());

    Instant next = read.nextRunAt().plus(Duration.ofDays(1));
    assertTrue(ledger.advanceSchedule("nightly", read.nextRunAt(), next));
    assertFalse(ledger.advanceSchedule("nightly", read.nextRunAt(), next.plus(Duration.ofDays(1))));
    assertEquals(next, ledger.readSchedule("nightly").nextRunAt());
  }

  @Test
  void occurrenceSlotIsUnique() {
    Instant slot = T0.plusSeconds(3600);
    RecurringSchedule schedule = new RecurringSchedule("hourly", "sync", new byte[0], 0, 1, 3,
        "1h", slot, T0, T0);
    ledger.insertSchedule(schedule, NewJob.builder("sync").recurrence("hourly", slot).runAt(slot).build());

    Optional<Job> occurrence = ledger.findOccurrence("hourly", slot);
    assertTrue(occurrence.isPresent());
    assertEquals(slot, occurrence.get().occurrenceAt());

    assertFalse(ledger.insertOccurrenceIfAbsent(
        NewJob.builder("sync").recurrence("hourly", slot).runAt(slot).build()));
    assertThrows(StoreException.class, () -> ledger.insertJob(
        NewJob.builder("sync").recurrence("hourly", slot).runAt(slot).build()));
    assertEquals(1, ledger.countByState(JobState.PENDING, "sync"));
  }

  @Test
  void customTablePrefixIsolatesQueues() {
    H2JobStore billing = new H2JobStore("billing");
    JdbcSchema.create(dataSource, billing);
    JobLedger billingLedger = new JobLedger(new DataSourceConnectionProvider(dataSource), billing, clock, 3);

    billingLedger.insertJob(NewJob.builder("invoice").build());

    assertEquals(1, billingLedger.countByState(JobState.PENDING, null));
    assertEquals(0, ledger.countByState(JobState.PENDING, null));
  }

  private List<Long> claimAll() {
    List<Long> order = new ArrayList<>();
    Optional<Job> next;
    while ((next = claims.claim()).isPresent()) {
      order.add(next.get().id());
    }
    return order;
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
