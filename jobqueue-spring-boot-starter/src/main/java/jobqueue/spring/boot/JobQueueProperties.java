package jobqueue.spring.boot;

import jobqueue.jdbc.TableNames;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the job queue.
 *
 * @see JobQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobqueue")
public class JobQueueProperties {

    /**
     * Whether to create the job queue beans at all.
     */
    private boolean enabled = true;

    /**
     * Prefix of the job, run-history and schedule tables.
     */
    private String tablePrefix = TableNames.DEFAULT_PREFIX;

    /**
     * Whether to start claiming jobs when the application context starts.
     */
    private boolean autoStart = true;

    /**
     * Whether to apply the bundled DDL for the detected database at startup.
     */
    private boolean initializeSchema = false;

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Recovery recovery = new Recovery();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        private int maxConcurrency = 4;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration drainTimeout = Duration.ofSeconds(30);

        /**
         * Job types this node claims. Empty means every type.
         */
        private Set<String> jobTypes = new LinkedHashSet<>();

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public Set<String> getJobTypes() {
            return jobTypes;
        }

        public void setJobTypes(Set<String> jobTypes) {
            this.jobTypes = jobTypes;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofSeconds(20);
        private Duration maxDelay = Duration.ofHours(1);
        private double jitter = 0.2;
        private int defaultMaxRetries = 3;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }
    }

    public static class Recovery {
        /**
         * How long a RUNNING job may go without a heartbeat before it counts as orphaned.
         */
        private Duration livenessThreshold = Duration.ofMinutes(2);

        /**
         * Period of the background recovery sweep. Zero runs the sweep only at startup.
         */
        private Duration interval = Duration.ZERO;

        public Duration getLivenessThreshold() {
            return livenessThreshold;
        }

        public void setLivenessThreshold(Duration livenessThreshold) {
            this.livenessThreshold = livenessThreshold;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
