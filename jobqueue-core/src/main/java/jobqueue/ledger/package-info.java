/**
 * The job ledger: every durable read and write the queue performs, one transaction per call.
 */
package jobqueue.ledger;
