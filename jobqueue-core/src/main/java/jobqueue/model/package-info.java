/**
 * Persistent data model: jobs, their states and run history, and recurring schedules.
 */
package jobqueue.model;
