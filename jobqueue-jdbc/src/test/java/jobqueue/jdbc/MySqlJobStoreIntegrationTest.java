package jobqueue.jdbc;

import jobqueue.jdbc.store.AbstractJdbcJobStore;
import jobqueue.jdbc.store.MySqlJobStore;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@RequiresDocker
@Testcontainers
class MySqlJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("jobqueue_test");

  private static SimpleDataSource dataSource;
  private final MySqlJobStore store = new MySqlJobStore();

  @BeforeAll
  static void initSchema() {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    JdbcSchema.create(dataSource, new MySqlJobStore());
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE TABLE jq_job");
      stmt.execute("TRUNCATE TABLE jq_job_run");
      stmt.execute("TRUNCATE TABLE jq_schedule");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcJobStore store() {
    return store;
  }
}
