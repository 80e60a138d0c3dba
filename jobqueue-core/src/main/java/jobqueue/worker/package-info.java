/**
 * Worker pool, handler SPI and the per-attempt job context.
 */
package jobqueue.worker;
