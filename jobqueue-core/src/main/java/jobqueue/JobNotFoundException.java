package jobqueue;

/**
 * Thrown when a job id or recurring schedule id does not exist.
 */
public final class JobNotFoundException extends JobQueueException {
  private final String id;

  public JobNotFoundException(String kind, Object id) {
    super(kind + " not found: " + id);
    this.id = String.valueOf(id);
  }

  public static JobNotFoundException job(long id) {
    return new JobNotFoundException("Job", id);
  }

  public static JobNotFoundException schedule(String scheduleId) {
    return new JobNotFoundException("Recurring schedule", scheduleId);
  }

  public String id() {
    return id;
  }
}
