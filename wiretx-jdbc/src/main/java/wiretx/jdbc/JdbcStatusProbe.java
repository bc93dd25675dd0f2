package wiretx.jdbc;

import wiretx.TransactionStatus;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Reads the transaction status the server reported on the most recent response of a JDBC
 * connection. The status must come from the driver's protocol state; it must not be inferred
 * from the SQL that was sent.
 *
 * @see PgJdbcStatusProbe
 */
@FunctionalInterface
public interface JdbcStatusProbe {

  TransactionStatus probe(Connection connection) throws SQLException;
}
