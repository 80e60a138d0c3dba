package jobqueue.worker;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link JobHandlerRegistry}. Each job type has exactly one handler.
 *
 * <pre>{@code
 * JobHandlerRegistry registry = new DefaultJobHandlerRegistry()
 *     .register("send-email", ctx -> mailer.send(ctx.payload()))
 *     .register("rebuild-index", indexer);
 * }</pre>
 */
public final class DefaultJobHandlerRegistry implements JobHandlerRegistry {
  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  /**
   * Registers the handler for a job type.
   *
   * @param jobType the job type
   * @param handler the handler
   * @return this registry for chaining
   * @throws IllegalArgumentException if {@code jobType} is blank
   * @throws IllegalStateException    if the job type already has a handler
   */
  public DefaultJobHandlerRegistry register(String jobType, JobHandler handler) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(handler, "handler");
    if (jobType.isBlank()) {
      throw new IllegalArgumentException("jobType must not be blank");
    }
    JobHandler existing = handlers.putIfAbsent(jobType, handler);
    if (existing != null) {
      throw new IllegalStateException("Duplicate handler for jobType=" + jobType);
    }
    return this;
  }

  @Override
  public JobHandler handlerFor(String jobType) {
    return jobType == null ? null : handlers.get(jobType);
  }

  @Override
  public Set<String> jobTypes() {
    return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
  }
}
