package jobqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry for JDBC job stores with auto-detection support.
 *
 * <p>Job stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/jobqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 *
 * // Auto-detect with a custom table prefix
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource, "billing");
 *
 * // Get by name
 * AbstractJdbcJobStore store = JdbcJobStores.get("postgresql");
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES;
  private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .collect(Collectors.toUnmodifiableList());

    for (AbstractJdbcJobStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcJobStores() {
  }

  /**
   * Returns all registered job stores.
   */
  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * Gets a job store by name.
   *
   * @param name job store name (case-insensitive)
   * @return the job store, using the default table prefix
   * @throws IllegalArgumentException if no job store is registered under that name
   */
  public static AbstractJdbcJobStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown job store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the job store from a DataSource.
   *
   * @param dataSource the data source
   * @return detected job store
   * @throws IllegalStateException if detection fails or no job store matches
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
  }

  /**
   * Auto-detects the job store from a DataSource and applies a table prefix.
   *
   * @param dataSource  the data source
   * @param tablePrefix prefix of the job, run and schedule tables
   * @return detected job store using {@code tablePrefix}
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource, String tablePrefix) {
    Objects.requireNonNull(tablePrefix, "tablePrefix");
    return detect(dataSource).withTablePrefix(tablePrefix);
  }

  /**
   * Auto-detects the job store from a JDBC URL.
   *
   * @param jdbcUrl the JDBC URL
   * @return detected job store
   * @throws IllegalArgumentException if no job store matches
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcJobStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .collect(Collectors.toList());
  }
}
