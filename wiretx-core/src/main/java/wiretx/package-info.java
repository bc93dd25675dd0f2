/**
 * Transaction and savepoint execution core of a PostgreSQL wire-protocol client.
 *
 * <h2>Core Design</h2>
 * <p>A {@link wiretx.WireConnection} sends every command through a single session that tracks
 * the transaction status the server reports after each round trip. Ordinary server errors are
 * returned as {@link wiretx.QueryOutcome.Failure} values. A status the client did not expect,
 * an error code listed in the disconnect policy, or a dropped socket terminates the connection
 * and is raised as {@link wiretx.ConnectionTerminatedException}.
 *
 * <p>{@link wiretx.WireConnection#transaction(wiretx.TransactionCallback) transaction()} runs
 * a body either in a {@code BEGIN}/{@code COMMIT} block ({@link wiretx.TransactionStrategy#STRICT})
 * or under a savepoint inside a transaction the caller opened itself
 * ({@link wiretx.TransactionStrategy#NAIVE}). Once a command in the body fails, later commands
 * are answered locally with {@code in_failed_sql_transaction} until the body rolls back.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>wiretx-core</b>: status tracking, error classification, savepoints and transactions
 *       (zero external deps)</li>
 *   <li><b>wiretx-jdbc</b>: a {@linkplain wiretx.spi.CommandExecutor command executor} over a
 *       JDBC connection, with PostgreSQL status probing</li>
 *   <li><b>wiretx-micrometer</b>: metrics exporter</li>
 *   <li><b>wiretx-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var factory = new JdbcWireConnectionFactory(dataSource,
 *     new TransactionConfig().setDisconnectOnErrorCodes(List.of("read_only_sql_transaction")));
 *
 * try (WireConnection conn = factory.open()) {
 *   TransactionOutcome<Long> outcome = conn.transaction(tx -> {
 *     QueryOutcome guarded = tx.query("INSERT INTO orders VALUES ($1)", List.of(42),
 *         QueryOptions.withSavepoint());
 *     if (!guarded.isSuccess()) {
 *       tx.rollback(guarded.error());
 *     }
 *     return guarded.orElseThrow().rowCount();
 *   });
 * }
 * }</pre>
 *
 * @see wiretx.WireConnection
 * @see wiretx.TransactionHandle
 * @see wiretx.TransactionOutcome
 * @see wiretx.QueryOutcome
 */
package wiretx;
