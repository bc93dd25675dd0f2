/**
 * Server transaction status tracking and desynchronization detection.
 *
 * @see wiretx.status.StatusTracker
 */
package wiretx.status;
