package jobqueue.spi;

import jobqueue.JobQueueException;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Failure of the durable store.
 *
 * <p>A <em>transient</em> failure (lock wait timeout, deadlock, serialization failure) may
 * succeed when retried and is retried internally by the claim protocol. Anything else is
 * <em>fatal</em>: it is surfaced to the caller and stops the worker pool from claiming.
 */
public class StoreException extends JobQueueException {
  private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
      "40001", // serialization failure
      "40P01", // PostgreSQL deadlock
      "HYT00", // H2 lock timeout
      "55P03"); // PostgreSQL lock not available
  private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(
      1205, // MySQL lock wait timeout
      1213, // MySQL deadlock
      50200, // H2 lock timeout
      90131); // H2 concurrent update

  private final boolean transientFailure;

  public StoreException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public StoreException(String message, SQLException cause) {
    this(message, cause, isTransient(cause));
  }

  public boolean isTransient() {
    return transientFailure;
  }

  /**
   * Classifies a JDBC error, following the {@link SQLException#getNextException() chain}.
   *
   * @param e the JDBC error
   * @return {@code true} if retrying the transaction may succeed
   */
  public static boolean isTransient(SQLException e) {
    for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
      if (cur instanceof SQLTransientException) {
        return true;
      }
      if (cur.getSQLState() != null && TRANSIENT_SQL_STATES.contains(cur.getSQLState())) {
        return true;
      }
      if (TRANSIENT_VENDOR_CODES.contains(cur.getErrorCode())) {
        return true;
      }
    }
    return false;
  }
}
