package wiretx;

/**
 * How {@link WireConnection#transaction(TransactionCallback)} delimits a transaction.
 * Fixed per connection.
 */
public enum TransactionStrategy {
  /**
   * The connection issues {@code BEGIN}, {@code COMMIT} and {@code ROLLBACK} itself and
   * verifies the server status after every round trip.
   */
  STRICT,
  /**
   * The caller has already opened a transaction. Each {@code transaction()} call is anchored
   * by a savepoint, so a rollback only undoes work done since that call.
   */
  NAIVE
}
