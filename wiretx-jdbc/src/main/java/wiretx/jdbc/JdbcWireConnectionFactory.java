package wiretx.jdbc;

import wiretx.TransactionConfig;
import wiretx.TransactionStatus;
import wiretx.WireConnection;
import wiretx.spi.MetricsExporter;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens {@link WireConnection}s on connections borrowed from a {@link DataSource}. Each
 * connection is switched to auto-commit, its current status is read from the driver, and it is
 * returned to the data source when the {@code WireConnection} is closed.
 *
 * <pre>{@code
 * var factory = new JdbcWireConnectionFactory(dataSource, new TransactionConfig());
 * try (WireConnection conn = factory.open()) {
 *   conn.transaction(tx -> tx.query("SELECT 1").orElseThrow());
 * }
 * }</pre>
 */
public final class JdbcWireConnectionFactory {
  private final DataSource dataSource;
  private final TransactionConfig config;
  private final JdbcStatusProbe statusProbe;
  private final MetricsExporter metrics;

  public JdbcWireConnectionFactory(DataSource dataSource, TransactionConfig config) {
    this(dataSource, config, PgJdbcStatusProbe.INSTANCE, MetricsExporter.NOOP);
  }

  public JdbcWireConnectionFactory(DataSource dataSource, TransactionConfig config,
      JdbcStatusProbe statusProbe, MetricsExporter metrics) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.config = Objects.requireNonNull(config, "config");
    this.statusProbe = Objects.requireNonNull(statusProbe, "statusProbe");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    // unknown disconnect codes throw here
    config.disconnectPolicy();
  }

  /**
   * Borrows a connection and wraps it.
   *
   * @throws SQLException if a connection cannot be obtained or prepared
   */
  public WireConnection open() throws SQLException {
    Connection connection = dataSource.getConnection();
    try {
      JdbcCommandExecutor executor = new JdbcCommandExecutor(connection, statusProbe);
      TransactionStatus initial = statusProbe.probe(connection);
      return WireConnection.builder()
          .executor(executor)
          .supervisor(new JdbcConnectionSupervisor(connection))
          .config(config)
          .metrics(metrics)
          .initialStatus(initial)
          .build();
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  public TransactionConfig config() {
    return config;
  }
}
