package jobqueue.jdbc;

import java.util.Objects;

/**
 * Table naming shared by the JDBC job stores and the bundled schema scripts.
 *
 * <p>All three tables share a prefix: {@code <prefix>_job}, {@code <prefix>_job_run} and
 * {@code <prefix>_schedule}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "jq";
  private static final String PREFIX_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.matches(PREFIX_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  public static String jobs(String prefix) {
    return validatePrefix(prefix) + "_job";
  }

  public static String runs(String prefix) {
    return validatePrefix(prefix) + "_job_run";
  }

  public static String schedules(String prefix) {
    return validatePrefix(prefix) + "_schedule";
  }
}
