/**
 * Retry decisions and backoff for failed attempts.
 */
package jobqueue.retry;
