package jobqueue.spring.boot;

import jobqueue.JobQueue;

import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link JobQueue} once the context is refreshed and closes it, draining running
 * handlers, when the context stops.
 */
public class JobQueueLifecycle implements SmartLifecycle {

  private final JobQueue jobQueue;
  private final boolean autoStart;
  private volatile boolean running;

  public JobQueueLifecycle(JobQueue jobQueue, boolean autoStart) {
    this.jobQueue = jobQueue;
    this.autoStart = autoStart;
  }

  @Override
  public void start() {
    jobQueue.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    jobQueue.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStart;
  }
}
