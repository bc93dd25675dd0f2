package wiretx.spi;

/**
 * Owner of the socket. Receives forced-termination requests from the transaction core.
 *
 * @see wiretx.jdbc.JdbcConnectionSupervisor
 */
@FunctionalInterface
public interface ConnectionSupervisor {

  /**
   * Fire-and-forget request to close the connection. The supervisor closes the socket; the
   * core delivers {@code reason} to every party awaiting the connection.
   *
   * @param reason why the connection is being terminated
   */
  void requestTermination(Throwable reason);
}
