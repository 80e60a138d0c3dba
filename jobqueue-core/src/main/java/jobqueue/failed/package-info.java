/**
 * Inspection and re-queueing of failed jobs.
 */
package jobqueue.failed;
