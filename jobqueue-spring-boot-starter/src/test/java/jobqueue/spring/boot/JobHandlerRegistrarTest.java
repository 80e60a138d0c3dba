package jobqueue.spring.boot;

import jobqueue.worker.DefaultJobHandlerRegistry;
import jobqueue.worker.JobContext;
import jobqueue.worker.JobHandler;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobHandlerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(RegistrarConfig.class);

  @Test
  void registersAnnotatedHandler() {
    runner.withUserConfiguration(EmailHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultJobHandlerRegistry.class);
      assertInstanceOf(SendEmailHandler.class, registry.handlerFor("send-email"));
    });
  }

  @Test
  void registersEveryAnnotatedBean() {
    runner.withUserConfiguration(EmailHandlerConfig.class, ReportHandlerConfig.class).run(ctx -> {
      var registry = ctx.getBean(DefaultJobHandlerRegistry.class);
      assertEquals(Set.of("build-report", "send-email"), registry.jobTypes());
    });
  }

  @Test
  void ignoresHandlerBeansWithoutAnnotation() {
    runner.withUserConfiguration(PlainHandlerConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertTrue(ctx.getBean(DefaultJobHandlerRegistry.class).jobTypes().isEmpty());
    });
  }

  @Test
  void failsWhenBeanDoesNotImplementJobHandler() {
    runner.withUserConfiguration(NotAHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenJobTypeIsBlank() {
    runner.withUserConfiguration(BlankTypeConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenTwoBeansClaimSameJobType() {
    runner.withUserConfiguration(EmailHandlerConfig.class, DuplicateEmailHandlerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
      assertTrue(ctx.getStartupFailure().getMessage().contains("send-email"));
    });
  }

  // ── Test support ─────────────────────────────────────────────

  @Configuration
  static class RegistrarConfig {
    @Bean
    DefaultJobHandlerRegistry jobHandlerRegistry() {
      return new DefaultJobHandlerRegistry();
    }

    @Bean
    JobHandlerRegistrar jobHandlerRegistrar(ListableBeanFactory beanFactory,
        DefaultJobHandlerRegistry jobHandlerRegistry) {
      return new JobHandlerRegistrar(beanFactory, jobHandlerRegistry);
    }
  }

  @JobHandlerFor("send-email")
  static class SendEmailHandler implements JobHandler {
    @Override
    public void handle(JobContext context) {
    }
  }

  @JobHandlerFor("send-email")
  static class OtherEmailHandler implements JobHandler {
    @Override
    public void handle(JobContext context) {
    }
  }

  @JobHandlerFor("build-report")
  static class BuildReportHandler implements JobHandler {
    @Override
    public void handle(JobContext context) {
    }
  }

  static class PlainHandler implements JobHandler {
    @Override
    public void handle(JobContext context) {
    }
  }

  @JobHandlerFor("not-a-handler")
  static class NotAHandler {
  }

  @JobHandlerFor(" ")
  static class BlankTypeHandler implements JobHandler {
    @Override
    public void handle(JobContext context) {
    }
  }

  @Configuration
  static class EmailHandlerConfig {
    @Bean
    SendEmailHandler sendEmailHandler() {
      return new SendEmailHandler();
    }
  }

  @Configuration
  static class DuplicateEmailHandlerConfig {
    @Bean
    OtherEmailHandler otherEmailHandler() {
      return new OtherEmailHandler();
    }
  }

  @Configuration
  static class ReportHandlerConfig {
    @Bean
    BuildReportHandler buildReportHandler() {
      return new BuildReportHandler();
    }
  }

  @Configuration
  static class PlainHandlerConfig {
    @Bean
    PlainHandler plainHandler() {
      return new PlainHandler();
    }
  }

  @Configuration
  static class NotAHandlerConfig {
    @Bean
    NotAHandler notAHandler() {
      return new NotAHandler();
    }
  }

  @Configuration
  static class BlankTypeConfig {
    @Bean
    BlankTypeHandler blankTypeHandler() {
      return new BlankTypeHandler();
    }
  }
}
