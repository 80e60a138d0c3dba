package jobqueue.jdbc.store;

import java.util.List;

/**
 * H2 job store. Primarily for testing and single-process embedding.
 *
 * <p>Uses the default unlocked candidate select from {@link AbstractJdbcJobStore}; concurrent
 * claimers of the same row are resolved by the guarded state transition.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcJobStore withTablePrefix(String tablePrefix) {
    return new H2JobStore(tablePrefix);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
