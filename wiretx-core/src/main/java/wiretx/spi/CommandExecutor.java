package wiretx.spi;

import wiretx.ConnectionTerminatedException;
import wiretx.QueryOutcome;
import wiretx.TransactionStatus;

import java.util.List;

/**
 * Synchronous "execute one command, get one structured outcome" primitive provided by the
 * wire layer. Exactly one command is in flight per connection; callers are serialized by the
 * collaborator.
 *
 * @see wiretx.jdbc.JdbcCommandExecutor
 */
public interface CommandExecutor extends AutoCloseable {

  /**
   * Sends one command and waits for its completion.
   *
   * @param sql    command text
   * @param params positional parameters, already in the form the wire layer encodes
   * @return a success with the result, or a failure carrying the server error
   * @throws ConnectionTerminatedException if the connection dropped while waiting
   */
  QueryOutcome execute(String sql, List<?> params);

  /**
   * Returns the transaction status carried on the most recent server response.
   */
  TransactionStatus currentStatus();

  /**
   * Releases the underlying connection. The default does nothing.
   */
  @Override
  default void close() {
  }
}
