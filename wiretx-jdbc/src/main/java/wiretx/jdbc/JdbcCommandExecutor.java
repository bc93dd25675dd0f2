package wiretx.jdbc;

import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import wiretx.ConnectionTerminatedException;
import wiretx.QueryOutcome;
import wiretx.QueryResult;
import wiretx.ServerError;
import wiretx.TransactionStatus;
import wiretx.spi.CommandExecutor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link CommandExecutor} over a JDBC connection.
 *
 * <p>The connection is kept in auto-commit mode so that the driver never issues transaction
 * control of its own: {@code BEGIN}, {@code COMMIT} and savepoint commands are sent as plain
 * statements and the driver's protocol state follows them. Statements without parameters run
 * through the simple query path; {@code $n} parameters are bound through a
 * {@link PreparedStatement}.
 *
 * <p>Server errors are returned as {@link QueryOutcome.Failure}. Connection-class SQLSTATEs
 * ({@code 08xxx}) and errors on a closed connection are raised as
 * {@link ConnectionTerminatedException}.
 */
public final class JdbcCommandExecutor implements CommandExecutor {
  private static final Logger logger = Logger.getLogger(JdbcCommandExecutor.class.getName());

  private static final String UNKNOWN_SQL_STATE = "XX000";

  private final Connection connection;
  private final JdbcStatusProbe statusProbe;

  /**
   * @throws SQLException if auto-commit cannot be enabled
   */
  public JdbcCommandExecutor(Connection connection, JdbcStatusProbe statusProbe) throws SQLException {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.statusProbe = Objects.requireNonNull(statusProbe, "statusProbe");
    if (!connection.getAutoCommit()) {
      connection.setAutoCommit(true);
    }
  }

  @Override
  public QueryOutcome execute(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    List<?> values = params == null ? List.of() : params;
    try {
      if (values.isEmpty()) {
        try (Statement statement = connection.createStatement()) {
          return QueryOutcome.success(collect(sql, statement, statement.execute(sql)));
        }
      }
      Placeholders.Rewritten rewritten = Placeholders.rewrite(sql, values);
      try (PreparedStatement statement = connection.prepareStatement(rewritten.sql())) {
        bindParams(statement, rewritten.params());
        return QueryOutcome.success(collect(sql, statement, statement.execute()));
      }
    } catch (SQLException e) {
      if (isConnectionLoss(e)) {
        throw new ConnectionTerminatedException(e);
      }
      return QueryOutcome.failure(toServerError(e));
    }
  }

  @Override
  public TransactionStatus currentStatus() {
    try {
      return statusProbe.probe(connection);
    } catch (SQLException e) {
      throw new ConnectionTerminatedException(e);
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close JDBC connection", e);
    }
  }

  private static QueryResult collect(String sql, Statement statement, boolean hasResultSet)
      throws SQLException {
    String command = commandTag(sql);
    if (!hasResultSet) {
      return QueryResult.command(command, Math.max(statement.getUpdateCount(), 0));
    }
    try (ResultSet rs = statement.getResultSet()) {
      ResultSetMetaData meta = rs.getMetaData();
      int columnCount = meta.getColumnCount();
      List<String> columns = new ArrayList<>(columnCount);
      for (int i = 1; i <= columnCount; i++) {
        columns.add(meta.getColumnLabel(i));
      }
      List<List<Object>> rows = new ArrayList<>();
      while (rs.next()) {
        List<Object> row = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
          row.add(rs.getObject(i));
        }
        rows.add(row);
      }
      return new QueryResult(command, columns, rows, rows.size());
    }
  }

  private static void bindParams(PreparedStatement ps, List<Object> params) throws SQLException {
    for (int i = 0; i < params.size(); i++) {
      Object param = params.get(i);
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private static String commandTag(String sql) {
    String trimmed = sql.stripLeading();
    int end = 0;
    while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
      end++;
    }
    return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
  }

  private boolean isConnectionLoss(SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith("08")) {
      return true;
    }
    try {
      return connection.isClosed();
    } catch (SQLException closedCheck) {
      e.addSuppressed(closedCheck);
      return true;
    }
  }

  static ServerError toServerError(SQLException e) {
    String state = e.getSQLState() != null ? e.getSQLState() : UNKNOWN_SQL_STATE;
    if (e instanceof PSQLException pe) {
      ServerErrorMessage server = pe.getServerErrorMessage();
      if (server != null && server.getMessage() != null) {
        String severity = server.getSeverity() != null ? server.getSeverity() : "ERROR";
        return new ServerError(state, severity, server.getMessage());
      }
    }
    return ServerError.of(state, e.getMessage() != null ? e.getMessage() : state);
  }
}
