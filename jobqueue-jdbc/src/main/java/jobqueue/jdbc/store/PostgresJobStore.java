package jobqueue.jdbc.store;

import jobqueue.NewJob;
import jobqueue.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>Locks the claim candidate with {@code FOR UPDATE SKIP LOCKED}, so concurrent claimers
 * move on to the next ready row instead of queueing behind each other. Inserts return the
 * new id with {@code RETURNING}.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcJobStore withTablePrefix(String tablePrefix) {
    return new PostgresJobStore(tablePrefix);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String lockClause() {
    return " FOR UPDATE SKIP LOCKED";
  }

  @Override
  public long insertJob(Connection conn, NewJob job, Instant now) {
    List<Long> ids = JdbcTemplate.updateReturning(conn, insertJobSql(" RETURNING id"),
        rs -> rs.getLong("id"), insertJobParams(job, now));
    return ids.get(0);
  }
}
