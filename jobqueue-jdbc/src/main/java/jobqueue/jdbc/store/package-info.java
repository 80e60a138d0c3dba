/**
 * Database-specific {@link jobqueue.spi.JobStore} implementations and their
 * {@link java.util.ServiceLoader}-based registry.
 */
package jobqueue.jdbc.store;
