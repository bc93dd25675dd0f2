package wiretx;

import wiretx.error.ErrorClassifier;
import wiretx.spi.CommandExecutor;
import wiretx.spi.ConnectionSupervisor;
import wiretx.spi.MetricsExporter;
import wiretx.status.StatusTracker;
import wiretx.tx.CommandSession;
import wiretx.tx.TransactionManager;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One logical database connection with transaction and savepoint management.
 *
 * <p>Wires a {@link CommandExecutor} and {@link ConnectionSupervisor} provided by the wire
 * layer to the transaction core, into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (WireConnection conn = WireConnection.builder()
 *     .executor(executor)
 *     .supervisor(supervisor)
 *     .config(new TransactionConfig().setDisconnectOnErrorCodes(List.of("read_only_sql_transaction")))
 *     .build()) {
 *
 *   TransactionOutcome<Long> outcome = conn.transaction(tx -> {
 *     QueryOutcome inserted = tx.query("INSERT INTO orders VALUES ($1)", List.of(42));
 *     if (!inserted.isSuccess()) {
 *       tx.rollback(inserted.error());
 *     }
 *     return inserted.orElseThrow().rowCount();
 *   });
 * }
 * }</pre>
 *
 * <p>Not thread-safe: exactly one command may be in flight. Callers sharing a connection must
 * be serialized by the owner of the connection. Termination, however, is observable from any
 * thread through {@link #termination()}.
 *
 * @see TransactionManager
 * @see CommandSession
 */
public final class WireConnection implements AutoCloseable {
  private final CommandSession session;
  private final TransactionManager transactions;

  private WireConnection(CommandSession session, TransactionManager transactions) {
    this.session = session;
    this.transactions = transactions;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs {@code callback} in a transaction delimited according to the configured
   * {@link TransactionStrategy}.
   *
   * @return {@link TransactionOutcome.Success} with the body's value, or
   *     {@link TransactionOutcome.RolledBack} with the rollback reason
   * @throws IllegalStateException          if a strict transaction is already open
   * @throws ConnectionTerminatedException  if the connection is terminated meanwhile
   * @throws TransactionBodyException       if the body threw a checked exception
   */
  public <T> TransactionOutcome<T> transaction(TransactionCallback<T> callback) {
    return transactions.transaction(callback);
  }

  /**
   * Runs a query. While a transaction body is running the query joins that transaction.
   *
   * @throws IllegalStateException         if {@code options} request a savepoint outside any
   *                                       transaction
   * @throws ConnectionTerminatedException if the connection is or becomes terminated
   */
  public QueryOutcome query(String sql, List<?> params, QueryOptions options) {
    return transactions.query(sql, params, options);
  }

  public QueryOutcome query(String sql, List<?> params) {
    return query(sql, params, QueryOptions.DEFAULT);
  }

  public QueryOutcome query(String sql) {
    return query(sql, List.of(), QueryOptions.DEFAULT);
  }

  /**
   * Verifies that the server still reports the status this connection believes it is in.
   *
   * @throws ConnectionTerminatedException on a mismatch
   */
  public void ping() {
    session.ping();
  }

  /**
   * Returns the transaction status this connection believes the server to be in.
   */
  public TransactionStatus status() {
    return session.believedStatus();
  }

  public TransactionStrategy strategy() {
    return transactions.strategy();
  }

  public boolean inTransaction() {
    return transactions.inTransaction();
  }

  /**
   * Returns {@code true} once the connection has been terminated, or a termination has been
   * decided.
   */
  public boolean isTerminated() {
    return session.isTerminated();
  }

  /**
   * Completes with the termination reason when the connection is terminated. Every observer
   * receives the same reason instance.
   */
  public CompletionStage<Throwable> termination() {
    return session.termination();
  }

  @Override
  public void close() {
    session.close();
  }

  /**
   * Builder for {@link WireConnection}. Each builder can be used once.
   */
  public static final class Builder {
    private CommandExecutor executor;
    private ConnectionSupervisor supervisor;
    private TransactionConfig config = new TransactionConfig();
    private MetricsExporter metrics;
    private Executor terminationExecutor;
    private TransactionStatus initialStatus = TransactionStatus.IDLE;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    public Builder executor(CommandExecutor executor) {
      this.executor = executor;
      return this;
    }

    public Builder supervisor(ConnectionSupervisor supervisor) {
      this.supervisor = supervisor;
      return this;
    }

    public Builder config(TransactionConfig config) {
      this.config = config;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Executor running disconnect-policy terminations after the triggering error has been
     * returned. Defaults to a shared pool of daemon threads.
     */
    public Builder terminationExecutor(Executor terminationExecutor) {
      this.terminationExecutor = terminationExecutor;
      return this;
    }

    /**
     * Status the server is in when the connection is handed over. Defaults to idle.
     */
    public Builder initialStatus(TransactionStatus initialStatus) {
      this.initialStatus = initialStatus;
      return this;
    }

    /**
     * Builds the connection.
     *
     * @throws NullPointerException     if executor, supervisor or config is missing
     * @throws IllegalArgumentException if the savepoint names collide or an error code is
     *                                  not recognized
     * @throws IllegalStateException    if this builder was already used
     */
    public WireConnection build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(executor, "executor");
      Objects.requireNonNull(supervisor, "supervisor");
      Objects.requireNonNull(config, "config");
      Objects.requireNonNull(initialStatus, "initialStatus");
      if (config.getQuerySavepointName().equals(config.getTransactionSavepointName())) {
        throw new IllegalArgumentException("Query and transaction savepoint names must differ");
      }
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      boolean lenient = config.getStrategy() == TransactionStrategy.NAIVE;
      CommandSession session = new CommandSession(executor, supervisor,
          new StatusTracker(lenient, initialStatus),
          new ErrorClassifier(config.disconnectPolicy()),
          exporter, terminationExecutor);
      return new WireConnection(session, new TransactionManager(session, config, exporter));
    }
  }
}
