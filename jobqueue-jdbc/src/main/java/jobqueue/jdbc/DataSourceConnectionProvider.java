package jobqueue.jdbc;

import jobqueue.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands the job ledger connections from an application {@link DataSource}.
 *
 * <p>Every claim, outcome, checkpoint and heartbeat is its own short transaction, so a running
 * queue holds at most one connection per busy worker plus one each for the claimer, the heartbeat
 * refresher and the recovery sweep. Size a pooled data source for {@code maxConcurrency + 3}.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    if (conn == null) {
      throw new SQLException("DataSource " + dataSource.getClass().getName() + " returned no connection");
    }
    return conn;
  }
}
