/**
 * JDBC support for the job queue: the {@link jobqueue.jdbc.JdbcTemplate} helper, a
 * {@link javax.sql.DataSource}-backed connection provider and the bundled schema scripts.
 *
 * <p>Store implementations live in {@link jobqueue.jdbc.store}.
 */
package jobqueue.jdbc;
