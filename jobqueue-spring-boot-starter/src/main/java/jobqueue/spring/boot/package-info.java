/**
 * Spring Boot auto-configuration: {@code jobqueue.*} properties, store detection from the
 * application's {@code DataSource}, {@link jobqueue.spring.boot.JobHandlerFor} handler beans and
 * Micrometer metrics.
 */
package jobqueue.spring.boot;
