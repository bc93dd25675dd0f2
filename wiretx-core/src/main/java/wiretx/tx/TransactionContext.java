package wiretx.tx;

import wiretx.QueryOutcome;
import wiretx.ServerError;
import wiretx.TransactionStrategy;
import wiretx.spi.MetricsExporter;
import wiretx.status.CommandKind;

import java.util.List;

/**
 * State of one {@code transaction()} call: its strategy, nesting depth and {@code failed} flag.
 *
 * <p>Once failed, every command except the rollback issued by the manager is answered locally
 * with {@code in_failed_sql_transaction} without contacting the server. Owned exclusively by
 * the call that created it.
 */
final class TransactionContext {
  private final TransactionStrategy strategy;
  private final TransactionContext parent;
  private final int depth;
  private final CommandSession session;
  private final MetricsExporter metrics;
  private boolean failed;
  private boolean completed;

  TransactionContext(TransactionStrategy strategy, TransactionContext parent,
      CommandSession session, MetricsExporter metrics) {
    this.strategy = strategy;
    this.parent = parent;
    this.depth = parent == null ? 1 : parent.depth + 1;
    this.session = session;
    this.metrics = metrics;
  }

  TransactionStrategy strategy() {
    return strategy;
  }

  TransactionContext parent() {
    return parent;
  }

  int depth() {
    return depth;
  }

  boolean isFailed() {
    return failed;
  }

  void markFailed() {
    failed = true;
  }

  /**
   * Runs a statement and fails this context if it returns an error.
   */
  QueryOutcome query(String sql, List<?> params) {
    QueryOutcome outcome = send(sql, params);
    if (!outcome.isSuccess()) {
      failed = true;
    }
    return outcome;
  }

  /**
   * Runs a statement without touching the {@code failed} flag. Used for work wrapped in a
   * savepoint, whose failure is undone by rolling back to the savepoint.
   */
  QueryOutcome send(String sql, List<?> params) {
    if (failed) {
      return shortCircuit();
    }
    return session.execute(CommandKind.STATEMENT, sql, params);
  }

  QueryOutcome shortCircuit() {
    metrics.incrementShortCircuited();
    return QueryOutcome.failure(ServerError.inFailedTransaction(),
        QueryOutcome.FailureKind.IN_FAILED_TRANSACTION);
  }

  void ensureActive() {
    if (completed) {
      throw new IllegalStateException("Transaction handle used after its transaction ended");
    }
  }

  void complete() {
    completed = true;
  }
}
