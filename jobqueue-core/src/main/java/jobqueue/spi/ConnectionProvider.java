package jobqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the queue's components. Every ledger operation borrows one
 * connection, runs a single transaction on it and closes it.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see jobqueue.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
