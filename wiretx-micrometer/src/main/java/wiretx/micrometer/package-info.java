/**
 * Micrometer metrics for the transaction core.
 */
package wiretx.micrometer;
