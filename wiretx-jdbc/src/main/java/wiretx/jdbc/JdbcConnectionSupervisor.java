package wiretx.jdbc;

import wiretx.spi.ConnectionSupervisor;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionSupervisor} that aborts the JDBC connection. {@link Connection#abort}
 * closes the socket without waiting for a command in flight, so the waiting caller is released
 * with a connection error.
 */
public final class JdbcConnectionSupervisor implements ConnectionSupervisor {
  private static final Logger logger = Logger.getLogger(JdbcConnectionSupervisor.class.getName());

  private final Connection connection;

  public JdbcConnectionSupervisor(Connection connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public void requestTermination(Throwable reason) {
    logger.log(Level.INFO, "Aborting JDBC connection: " + reason.getMessage());
    try {
      connection.abort(Runnable::run);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Abort failed, closing JDBC connection instead", e);
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
        logger.log(Level.WARNING, "Failed to close JDBC connection", closeFailure);
      }
    }
  }
}
