/**
 * The claim protocol: exclusive, ranked hand-off of ready jobs to workers.
 */
package jobqueue.claim;
