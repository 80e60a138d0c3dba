package jobqueue.model;

import java.time.Instant;

/**
 * One execution attempt of a job. {@code finishedAt} and {@code success} stay {@code null}
 * while the attempt is in flight.
 *
 * <p>An attempt whose claim was returned by the recovery sweep is closed as unsuccessful with
 * {@link JobTransition#ORPHANED} as its info.
 */
public record RunInfo(
    int attempt,
    Instant startedAt,
    Instant finishedAt,
    Boolean success,
    String info) {

  /** Whether the process running this attempt died before the handler finished. */
  public boolean orphaned() {
    return Boolean.FALSE.equals(success) && JobTransition.ORPHANED.equals(info);
  }
}
