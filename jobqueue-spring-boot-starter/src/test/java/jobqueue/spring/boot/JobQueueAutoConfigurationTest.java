package jobqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jobqueue.JobQueue;
import jobqueue.jdbc.DataSourceConnectionProvider;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.H2JobStore;
import jobqueue.model.JobState;
import jobqueue.spi.ConnectionProvider;
import jobqueue.worker.DefaultJobHandlerRegistry;
import jobqueue.worker.JobContext;
import jobqueue.worker.JobHandler;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobQueueAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          JobQueueAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:jq_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "jobqueue.initialize-schema=true",
          "jobqueue.worker.poll-interval=50ms");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("jobStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("jobHandlerRegistry"));
      assertTrue(ctx.containsBean("jobHandlerRegistrar"));
      assertTrue(ctx.containsBean("jobQueue"));
      assertTrue(ctx.containsBean("jobQueueLifecycle"));

      assertInstanceOf(H2JobStore.class, ctx.getBean(AbstractJdbcJobStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertTrue(ctx.getBean(JobQueueLifecycle.class).isRunning());
    });
  }

  @Test
  void registersAnnotatedHandlers() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultJobHandlerRegistry.class);
      assertSame(ctx.getBean(RecordingHandler.class), registry.handlerFor("auto-test"));
    });
  }

  @Test
  void customTablePrefix() {
    runner
        .withPropertyValues("jobqueue.table-prefix=app_jq")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          var store = ctx.getBean(AbstractJdbcJobStore.class);
          assertInstanceOf(H2JobStore.class, store);
          assertEquals("app_jq", store.tablePrefix());
        });
  }

  @Test
  void runsEnqueuedJobsWhenAutoStarted() {
    runner.withUserConfiguration(HandlerConfig.class).run(ctx -> {
      JobQueue queue = ctx.getBean(JobQueue.class);
      RecordingHandler handler = ctx.getBean(RecordingHandler.class);

      long id = queue.enqueue("auto-test", "hello".getBytes(StandardCharsets.UTF_8));

      assertTrue(handler.done.await(10, TimeUnit.SECONDS));
      assertEquals(List.of("hello"), handler.payloads);
      long deadline = System.currentTimeMillis() + 5000;
      while (queue.getStatus(id).state() != JobState.SUCCEEDED
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      assertEquals(JobState.SUCCEEDED, queue.getStatus(id).state());
    });
  }

  @Test
  void autoStartDisabledLeavesJobsPending() {
    runner
        .withPropertyValues("jobqueue.auto-start=false")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          assertFalse(ctx.getBean(JobQueueLifecycle.class).isRunning());
          JobQueue queue = ctx.getBean(JobQueue.class);
          long id = queue.enqueue("auto-test", new byte[0]);
          Thread.sleep(200);
          assertEquals(JobState.PENDING, queue.getStatus(id).state());
          assertEquals(1, ctx.getBean(RecordingHandler.class).done.getCount());
        });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner
        .withPropertyValues("jobqueue.enabled=false")
        .withUserConfiguration(HandlerConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("jobQueue"));
          assertFalse(ctx.containsBean("jobStore"));
        });
  }

  @Test
  void backsOffWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(JobQueueAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("jobQueue")));
  }

  @Test
  void wiresMicrometerExporterIntoQueue() {
    runner
        .withConfiguration(AutoConfigurations.of(JobQueueMicrometerAutoConfiguration.class))
        .withPropertyValues("jobqueue.auto-start=false")
        .withUserConfiguration(HandlerConfig.class, MeterRegistryConfig.class).run(ctx -> {
          ctx.getBean(JobQueue.class).enqueue("auto-test", new byte[0]);
          var registry = ctx.getBean(MeterRegistry.class);
          assertEquals(1.0, registry.get("jobqueue.jobs.enqueued").counter().count());
        });
  }

  @Configuration
  static class HandlerConfig {
    @Bean
    RecordingHandler recordingHandler() {
      return new RecordingHandler();
    }
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @JobHandlerFor("auto-test")
  static class RecordingHandler implements JobHandler {
    final List<String> payloads = new CopyOnWriteArrayList<>();
    final CountDownLatch done = new CountDownLatch(1);

    @Override
    public void handle(JobContext context) {
      payloads.add(new String(context.payload(), StandardCharsets.UTF_8));
      done.countDown();
    }
  }
}
