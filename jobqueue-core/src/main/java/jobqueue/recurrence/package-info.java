/**
 * Recurring schedules: cadence evaluation and idempotent, non-skipping materialization of
 * occurrences.
 */
package jobqueue.recurrence;
