package jobqueue.jdbc;

import jobqueue.jdbc.store.AbstractJdbcJobStore;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the bundled DDL ({@code /schema/<store name>.sql}) and applies it.
 *
 * <p>The scripts are written for the default {@code jq} prefix; the store's prefix is
 * substituted when it differs.
 */
public final class JdbcSchema {
  private static final Logger logger = Logger.getLogger(JdbcSchema.class.getName());

  private JdbcSchema() {}

  /**
   * Returns the DDL statements for the given store, adjusted to its table prefix.
   *
   * @throws IllegalArgumentException if no script is bundled for the store
   */
  public static List<String> statements(AbstractJdbcJobStore store) {
    String path = "/schema/" + store.name() + ".sql";
    String script;
    try (InputStream in = JdbcSchema.class.getResourceAsStream(path)) {
      if (in == null) {
        throw new IllegalArgumentException("No bundled schema for job store: " + store.name());
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + path, e);
    }
    if (!TableNames.DEFAULT_PREFIX.equals(store.tablePrefix())) {
      script = script.replace(TableNames.DEFAULT_PREFIX + "_", store.tablePrefix() + "_");
    }
    List<String> statements = new ArrayList<>();
    for (String stmt : script.split(";")) {
      String trimmed = stripComments(stmt).trim();
      if (!trimmed.isEmpty()) {
        statements.add(trimmed);
      }
    }
    return statements;
  }

  /**
   * Creates the job, run-history and schedule tables and their indexes. Statements use
   * {@code IF NOT EXISTS}, so running this against an existing schema is harmless.
   */
  public static void create(DataSource dataSource, AbstractJdbcJobStore store) {
    List<String> statements = statements(store);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new JobStoreException("Failed to create job queue schema", e);
    }
    logger.log(Level.INFO, "Created job queue schema for {0} (prefix={1})",
        new Object[]{store.name(), store.tablePrefix()});
  }

  private static String stripComments(String stmt) {
    StringBuilder sb = new StringBuilder();
    for (String line : stmt.split("\n")) {
      if (!line.trim().startsWith("--")) {
        sb.append(line).append('\n');
      }
    }
    return sb.toString();
  }
}
