/**
 * Small shared helpers.
 */
package jobqueue.util;
