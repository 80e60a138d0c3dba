package jobqueue.spring.boot;

import jobqueue.JobQueue;
import jobqueue.jdbc.DataSourceConnectionProvider;
import jobqueue.jdbc.JdbcSchema;
import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.JdbcJobStores;
import jobqueue.recurrence.CadenceEvaluator;
import jobqueue.retry.RetryPolicy;
import jobqueue.spi.ConnectionProvider;
import jobqueue.spi.MetricsExporter;
import jobqueue.worker.DefaultJobHandlerRegistry;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the job queue.
 *
 * <p>Wires up a {@link JobQueue} from a {@link DataSource} and {@link JobQueueProperties}.
 * The job store is detected from the database product, handlers are collected from beans
 * annotated with {@link JobHandlerFor}, and the queue is started by {@link JobQueueLifecycle}
 * unless {@code jobqueue.auto-start=false}. Optional {@link RetryPolicy},
 * {@link CadenceEvaluator} and {@link MetricsExporter} beans replace the defaults.
 *
 * @see JobQueueProperties
 * @see JobQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JobQueue.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "jobqueue", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(JobQueueProperties.class)
public class JobQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcJobStore jobStore(DataSource dataSource, JobQueueProperties props) {
    return JdbcJobStores.detect(dataSource, props.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultJobHandlerRegistry jobHandlerRegistry() {
    return new DefaultJobHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobHandlerRegistrar jobHandlerRegistrar(
      ListableBeanFactory beanFactory, DefaultJobHandlerRegistry jobHandlerRegistry) {
    return new JobHandlerRegistrar(beanFactory, jobHandlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public JobQueue jobQueue(JobQueueProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      AbstractJdbcJobStore jobStore,
      DefaultJobHandlerRegistry jobHandlerRegistry,
      ObjectProvider<RetryPolicy> retryPolicyProvider,
      ObjectProvider<CadenceEvaluator> cadenceEvaluatorProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    if (props.isInitializeSchema()) {
      JdbcSchema.create(dataSource, jobStore);
    }

    JobQueueProperties.Worker worker = props.getWorker();
    JobQueueProperties.Retry retry = props.getRetry();
    JobQueue.Builder builder = JobQueue.builder()
        .connectionProvider(connectionProvider)
        .store(jobStore)
        .registry(jobHandlerRegistry)
        .maxConcurrency(worker.getMaxConcurrency())
        .pollInterval(worker.getPollInterval())
        .heartbeatInterval(worker.getHeartbeatInterval())
        .drainTimeout(worker.getDrainTimeout())
        .jobTypes(worker.getJobTypes())
        .retryBaseDelay(retry.getBaseDelay())
        .retryMaxDelay(retry.getMaxDelay())
        .retryJitter(retry.getJitter())
        .defaultMaxRetries(retry.getDefaultMaxRetries())
        .livenessThreshold(props.getRecovery().getLivenessThreshold())
        .recoveryInterval(props.getRecovery().getInterval());
    retryPolicyProvider.ifAvailable(builder::retryPolicy);
    cadenceEvaluatorProvider.ifAvailable(builder::cadenceEvaluator);
    metricsProvider.ifAvailable(builder::metrics);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobQueueLifecycle jobQueueLifecycle(JobQueue jobQueue, JobQueueProperties props) {
    return new JobQueueLifecycle(jobQueue, props.isAutoStart());
  }
}
