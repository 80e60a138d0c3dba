package jobqueue.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobqueue.JobQueue;
import jobqueue.JobValidationException;
import jobqueue.NewJob;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.JdbcJobStores;
import jobqueue.model.JobState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private AbstractJdbcJobStore store;
  private final List<JobQueue> queues = new ArrayList<>();

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("jobqueue-test-pool");

    hikariDs = new HikariDataSource(config);
    store = JdbcJobStores.detect(hikariDs);
    JdbcSchema.create(hikariDs, store);
  }

  @AfterEach
  void tearDown() {
    for (JobQueue queue : queues) {
      queue.close();
    }
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void queuesSharingOnePoolRunEachJobOnce() throws Exception {
    int jobs = 40;
    Set<Long> seen = ConcurrentHashMap.newKeySet();
    List<Long> duplicates = new ArrayList<>();
    CountDownLatch done = new CountDownLatch(jobs);
    for (int i = 0; i < 2; i++) {
      queues.add(JobQueue.builder()
          .connectionProvider(new DataSourceConnectionProvider(hikariDs))
          .store(store)
          .maxConcurrency(3)
          .pollInterval(Duration.ofMillis(20))
          .handler("pooled", ctx -> {
            if (!seen.add(ctx.jobId())) {
              synchronized (duplicates) {
                duplicates.add(ctx.jobId());
              }
            }
            done.countDown();
          })
          .build());
    }
    for (int i = 0; i < jobs; i++) {
      queues.get(i % 2).enqueue(NewJob.builder("pooled").priority(i % 3).build());
    }

    queues.forEach(JobQueue::start);

    assertTrue(done.await(30, TimeUnit.SECONDS), "not all jobs ran");
    assertTrue(duplicates.isEmpty(), "jobs ran twice: " + duplicates);
    JobQueue any = queues.get(0);
    long deadline = System.currentTimeMillis() + 10_000;
    while (any.ledger().countByState(JobState.SUCCEEDED, "pooled") < jobs
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    assertEquals(jobs, any.ledger().countByState(JobState.SUCCEEDED, "pooled"));
  }

  @Test
  void enqueueAllIsAtomicOverPooledConnections() {
    JobQueue queue = JobQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .store(store)
        .build();
    queues.add(queue);

    List<NewJob> batch = List.of(
        NewJob.builder("a").build(),
        NewJob.builder("b").build(),
        NewJob.builder("c").recurrence("missing-schedule", Instant.now()).build());

    assertThrows(JobValidationException.class, () -> queue.enqueueAll(batch));
    assertEquals(0, queue.ledger().countByState(JobState.PENDING, null));
  }
}
