/**
 * Startup and periodic recovery of jobs whose worker stopped heartbeating.
 */
package jobqueue.recovery;
