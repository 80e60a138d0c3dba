package jobqueue.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void returnsFreshConnectionsFromDataSource() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:provider_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1");

    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    try (Connection first = provider.getConnection(); Connection second = provider.getConnection()) {
      assertFalse(first.isClosed());
      assertNotSame(first, second);
    }
  }

  @Test
  void dataSourceReturningNoConnectionFailsInsteadOfHandingOutNull() {
    DataSource broken = (DataSource) Proxy.newProxyInstance(
        DataSource.class.getClassLoader(), new Class<?>[]{DataSource.class}, (proxy, method, args) -> null);

    SQLException e = assertThrows(SQLException.class,
        () -> new DataSourceConnectionProvider(broken).getConnection());
    assertTrue(e.getMessage().contains("returned no connection"), e.getMessage());
  }
}
