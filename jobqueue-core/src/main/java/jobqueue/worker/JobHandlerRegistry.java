package jobqueue.worker;

import java.util.Set;

/**
 * Maps job types to their handlers.
 *
 * @see DefaultJobHandlerRegistry
 */
public interface JobHandlerRegistry {

  /**
   * Returns the handler for {@code jobType}, or {@code null} if none is registered.
   *
   * @param jobType the job type
   * @return the handler, or {@code null}
   */
  JobHandler handlerFor(String jobType);

  /** Returns the registered job types. */
  Set<String> jobTypes();
}
