package jobqueue.jdbc;

import jobqueue.spi.StoreException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link jobqueue.jdbc.store.AbstractJdbcJobStore}
 * and its subclasses. Lock timeouts, deadlocks and serialization failures are classified as
 * transient.
 */
public final class JobStoreException extends StoreException {
  public JobStoreException(String message, SQLException cause) {
    super(message, cause);
  }
}
