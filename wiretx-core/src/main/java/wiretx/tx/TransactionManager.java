package wiretx.tx;

import wiretx.ConnectionTerminatedException;
import wiretx.QueryOptions;
import wiretx.QueryOutcome;
import wiretx.TransactionBodyException;
import wiretx.TransactionCallback;
import wiretx.TransactionConfig;
import wiretx.TransactionHandle;
import wiretx.TransactionOutcome;
import wiretx.TransactionStrategy;
import wiretx.spi.MetricsExporter;
import wiretx.status.CommandKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs transaction bodies on one connection under a fixed {@link TransactionStrategy}.
 *
 * <p><b>Strict</b>: issues {@code BEGIN}, runs the body, then {@code COMMIT} if it returned or
 * {@code ROLLBACK} if it called {@link TransactionHandle#rollback(Object)}. A body returning
 * after one of its queries failed is rolled back instead of committed. A commit rejected by
 * the server is reported as a rollback. Strict transactions do not nest.
 *
 * <p><b>Naive</b>: assumes the caller opened a transaction already and anchors each call with
 * a savepoint. Committing releases the anchor; rolling back returns to it and releases it,
 * leaving the outer transaction usable. Naive transactions nest, each level with its own anchor.
 *
 * <p>Ordinary server errors never escape as exceptions: {@code transaction()} returns
 * {@link TransactionOutcome.Success} or {@link TransactionOutcome.RolledBack}. Only connection
 * termination is raised, as {@link ConnectionTerminatedException}.
 */
public final class TransactionManager {
  private static final Logger logger = Logger.getLogger(TransactionManager.class.getName());

  private final CommandSession session;
  private final TransactionStrategy strategy;
  private final String querySavepointName;
  private final String transactionSavepointName;
  private final MetricsExporter metrics;
  private final SavepointScope savepoints;

  private TransactionContext current;

  public TransactionManager(CommandSession session, TransactionConfig config, MetricsExporter metrics) {
    this.session = Objects.requireNonNull(session, "session");
    Objects.requireNonNull(config, "config");
    this.strategy = config.getStrategy();
    this.querySavepointName = config.getQuerySavepointName();
    this.transactionSavepointName = config.getTransactionSavepointName();
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.savepoints = new SavepointScope(session, this.metrics);
  }

  public TransactionStrategy strategy() {
    return strategy;
  }

  /**
   * Returns {@code true} while a {@code transaction()} body is running.
   */
  public boolean inTransaction() {
    return current != null;
  }

  /**
   * Runs {@code callback} in a transaction.
   *
   * @throws IllegalStateException         if a strict transaction is already open
   * @throws ConnectionTerminatedException if the connection is terminated meanwhile
   * @throws TransactionBodyException      if the body threw a checked exception
   */
  public <T> TransactionOutcome<T> transaction(TransactionCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    if (strategy == TransactionStrategy.NAIVE) {
      return runNaive(current, callback);
    }
    if (current != null) {
      throw new IllegalStateException("A strict transaction is already open on this connection");
    }
    return runStrict(callback);
  }

  /**
   * Runs a query. Inside a running body the query joins the current transaction; outside, it
   * runs on its own.
   *
   * @throws IllegalStateException if a savepoint is requested outside any transaction
   */
  public QueryOutcome query(String sql, List<?> params, QueryOptions options) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(options, "options");
    if (current != null) {
      return query(current, sql, params, options);
    }
    if (options.savepoint()) {
      throw new IllegalStateException("A savepoint query requires an open transaction");
    }
    return session.execute(CommandKind.STATEMENT, sql, params);
  }

  private QueryOutcome query(TransactionContext context, String sql, List<?> params, QueryOptions options) {
    context.ensureActive();
    if (options.savepoint()) {
      return savepoints.run(context, querySavepointName, () -> context.send(sql, params));
    }
    return context.query(sql, params);
  }

  private <T> TransactionOutcome<T> runStrict(TransactionCallback<T> callback) {
    QueryOutcome begin = session.execute(CommandKind.BEGIN, "BEGIN");
    if (!begin.isSuccess()) {
      return rolledBack(begin.error());
    }
    TransactionContext context = new TransactionContext(TransactionStrategy.STRICT, null, session, metrics);
    current = context;
    try {
      T value = callback.doInTransaction(new ContextHandle(context));
      return commitStrict(context, value);
    } catch (RollbackSignal signal) {
      session.execute(CommandKind.ROLLBACK, "ROLLBACK");
      return rolledBack(signal.reason());
    } catch (ConnectionTerminatedException e) {
      throw e;
    } catch (RuntimeException e) {
      rollbackAfterError(e, () -> session.execute(CommandKind.ROLLBACK, "ROLLBACK"));
      throw e;
    } catch (Exception e) {
      rollbackAfterError(e, () -> session.execute(CommandKind.ROLLBACK, "ROLLBACK"));
      throw new TransactionBodyException(e);
    } finally {
      context.complete();
      current = null;
    }
  }

  private <T> TransactionOutcome<T> commitStrict(TransactionContext context, T value) {
    if (context.isFailed()) {
      // COMMIT would be short-circuited: roll back instead
      logger.fine("Transaction failed before commit, rolling back");
      session.execute(CommandKind.ROLLBACK, "ROLLBACK");
      return rolledBack(TransactionOutcome.IMPLICIT_ROLLBACK);
    }
    QueryOutcome commit = session.execute(CommandKind.COMMIT, "COMMIT");
    if (!commit.isSuccess()) {
      logger.log(Level.FINE, "COMMIT rejected, transaction rolled back: " + commit.error());
      return rolledBack(TransactionOutcome.IMPLICIT_ROLLBACK);
    }
    metrics.incrementCommitted();
    return TransactionOutcome.success(value);
  }

  private <T> TransactionOutcome<T> runNaive(TransactionContext enclosing, TransactionCallback<T> callback) {
    int depth = enclosing == null ? 1 : enclosing.depth() + 1;
    String anchor = depth == 1 ? transactionSavepointName : transactionSavepointName + "_" + depth;
    SavepointFrame frame = savepoints.open(enclosing, anchor);
    if (frame.openError() != null) {
      return rolledBack(frame.openError());
    }
    TransactionContext context = new TransactionContext(TransactionStrategy.NAIVE, enclosing, session, metrics);
    TransactionContext previous = current;
    if (!frame.isActive()) {
      // enclosing transaction already failed: the body runs, its queries fail fast
      context.markFailed();
    }
    current = context;
    try {
      T value = callback.doInTransaction(new ContextHandle(context));
      return releaseNaive(context, frame, value);
    } catch (RollbackSignal signal) {
      savepoints.close(frame, true);
      if (signal.context() != context) {
        throw signal;
      }
      return rolledBack(signal.reason());
    } catch (ConnectionTerminatedException e) {
      throw e;
    } catch (RuntimeException e) {
      rollbackAfterError(e, () -> savepoints.close(frame, true));
      throw e;
    } catch (Exception e) {
      rollbackAfterError(e, () -> savepoints.close(frame, true));
      throw new TransactionBodyException(e);
    } finally {
      context.complete();
      current = previous;
    }
  }

  private <T> TransactionOutcome<T> releaseNaive(TransactionContext context, SavepointFrame frame, T value) {
    if (context.isFailed()) {
      logger.fine("Transaction failed before release, rolling back to savepoint " + frame.name());
      savepoints.close(frame, true);
      return rolledBack(TransactionOutcome.IMPLICIT_ROLLBACK);
    }
    Optional<QueryOutcome.Failure> releaseFailure = savepoints.close(frame, false);
    if (releaseFailure.isPresent()) {
      return rolledBack(TransactionOutcome.IMPLICIT_ROLLBACK);
    }
    metrics.incrementCommitted();
    return TransactionOutcome.success(value);
  }

  private void rollbackAfterError(Exception failure, Runnable rollback) {
    if (session.isTerminated()) {
      return;
    }
    try {
      rollback.run();
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback after failed transaction body did not complete", e);
    }
  }

  private <T> TransactionOutcome<T> rolledBack(Object reason) {
    metrics.incrementRolledBack();
    return TransactionOutcome.rolledBack(reason);
  }

  private final class ContextHandle implements TransactionHandle {
    private final TransactionContext context;

    private ContextHandle(TransactionContext context) {
      this.context = context;
    }

    @Override
    public QueryOutcome query(String sql, List<?> params, QueryOptions options) {
      Objects.requireNonNull(sql, "sql");
      Objects.requireNonNull(options, "options");
      return TransactionManager.this.query(context, sql, params, options);
    }

    @Override
    public void rollback(Object reason) {
      Objects.requireNonNull(reason, "reason");
      context.ensureActive();
      throw new RollbackSignal(context, reason);
    }

    @Override
    public <R> TransactionOutcome<R> transaction(TransactionCallback<R> callback) {
      Objects.requireNonNull(callback, "callback");
      context.ensureActive();
      if (context.strategy() == TransactionStrategy.STRICT) {
        throw new IllegalStateException("A strict transaction is already open on this connection");
      }
      return runNaive(context, callback);
    }

    @Override
    public boolean isFailed() {
      return context.isFailed();
    }
  }
}
