/**
 * JDBC implementation of the command executor and connection supervisor, with transaction
 * status read from the PostgreSQL driver.
 *
 * @see wiretx.jdbc.JdbcWireConnectionFactory
 */
package wiretx.jdbc;
