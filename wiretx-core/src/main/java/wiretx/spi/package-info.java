/**
 * Service provider interfaces implemented by the collaborators of the transaction core.
 *
 * <ul>
 *   <li>{@link wiretx.spi.CommandExecutor}: sends one command, returns one outcome and
 *       exposes the server-reported transaction status</li>
 *   <li>{@link wiretx.spi.ConnectionSupervisor}: closes the socket on request</li>
 *   <li>{@link wiretx.spi.MetricsExporter}: counters for monitoring backends</li>
 * </ul>
 */
package wiretx.spi;
