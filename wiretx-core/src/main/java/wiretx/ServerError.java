package wiretx;

import java.util.Objects;

/**
 * Structured error returned by the server (or synthesized locally) for a single command.
 *
 * <p>Ordinary server errors are values: they are returned inside a
 * {@link QueryOutcome.Failure}, never thrown.
 *
 * @param sqlState five-character SQLSTATE code
 * @param severity severity as reported by the server, e.g. {@code ERROR}
 * @param message  primary human-readable message
 */
public record ServerError(String sqlState, String severity, String message) {

  public ServerError {
    Objects.requireNonNull(sqlState, "sqlState");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
  }

  public static ServerError of(String sqlState, String message) {
    return new ServerError(sqlState, "ERROR", message);
  }

  /**
   * The error produced locally for commands attempted in an already failed transaction.
   */
  public static ServerError inFailedTransaction() {
    return of(SqlState.IN_FAILED_SQL_TRANSACTION,
        "current transaction is aborted, commands ignored until end of transaction block");
  }

  /**
   * Returns the condition name (e.g. {@code unique_violation}), or {@code null} if unknown.
   */
  public String conditionName() {
    return SqlState.nameOf(sqlState);
  }

  @Override
  public String toString() {
    String name = conditionName();
    return severity + " " + sqlState + (name != null ? " (" + name + ")" : "") + " " + message;
  }
}
