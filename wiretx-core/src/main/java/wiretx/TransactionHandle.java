package wiretx;

import java.util.List;

/**
 * Handle passed to a transaction body. Valid only while the body runs.
 */
public interface TransactionHandle {

  /**
   * Runs a query in this transaction. If the transaction has already failed, the query is not
   * sent and an {@code in_failed_sql_transaction} failure is returned.
   */
  QueryOutcome query(String sql, List<?> params, QueryOptions options);

  default QueryOutcome query(String sql, List<?> params) {
    return query(sql, params, QueryOptions.DEFAULT);
  }

  default QueryOutcome query(String sql) {
    return query(sql, List.of(), QueryOptions.DEFAULT);
  }

  /**
   * Rolls back to the nearest enclosing {@code transaction()} call, which then returns
   * {@link TransactionOutcome.RolledBack} with {@code reason}. Never returns normally.
   *
   * @param reason value reported as the rollback reason
   */
  void rollback(Object reason);

  /**
   * Runs a nested transaction. Supported by the naive strategy only.
   *
   * @throws IllegalStateException under the strict strategy
   */
  <T> TransactionOutcome<T> transaction(TransactionCallback<T> callback);

  /**
   * Returns {@code true} once a query in this transaction has failed.
   */
  boolean isFailed();
}
