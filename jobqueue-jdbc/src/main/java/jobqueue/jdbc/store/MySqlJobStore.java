package jobqueue.jdbc.store;

import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>Requires MySQL 8.0 or later: the claim candidate is locked with
 * {@code FOR UPDATE SKIP LOCKED}.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcJobStore withTablePrefix(String tablePrefix) {
    return new MySqlJobStore(tablePrefix);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String lockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }
}
