package wiretx.jdbc;

import org.postgresql.core.BaseConnection;
import org.postgresql.core.TransactionState;
import wiretx.TransactionStatus;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link JdbcStatusProbe} for the PostgreSQL JDBC driver. pgjdbc records the status byte of
 * every ReadyForQuery message; this probe unwraps the driver connection, also through pools,
 * and maps that state.
 */
public final class PgJdbcStatusProbe implements JdbcStatusProbe {

  public static final PgJdbcStatusProbe INSTANCE = new PgJdbcStatusProbe();

  private PgJdbcStatusProbe() {}

  @Override
  public TransactionStatus probe(Connection connection) throws SQLException {
    BaseConnection pg = connection.unwrap(BaseConnection.class);
    return map(pg.getTransactionState());
  }

  static TransactionStatus map(TransactionState state) {
    return switch (state) {
      case IDLE -> TransactionStatus.IDLE;
      case OPEN -> TransactionStatus.IN_TRANSACTION;
      case FAILED -> TransactionStatus.FAILED;
    };
  }
}
