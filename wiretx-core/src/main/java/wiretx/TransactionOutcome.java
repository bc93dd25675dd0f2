package wiretx;

import java.util.Objects;

/**
 * Definite result of {@link WireConnection#transaction(TransactionCallback)}.
 *
 * <ul>
 *   <li>{@link Success}: the body returned and its work was committed (or, in naive mode,
 *       its anchor savepoint was released).</li>
 *   <li>{@link RolledBack}: the work was rolled back, either because the body called
 *       {@link TransactionHandle#rollback(Object)} or because the transaction could not be
 *       committed.</li>
 * </ul>
 *
 * @param <T> the body's return type
 */
public sealed interface TransactionOutcome<T>
    permits TransactionOutcome.Success, TransactionOutcome.RolledBack {

  /**
   * Rollback reason used when the transaction was rolled back without the body asking for it,
   * e.g. because the body returned after a query had failed.
   */
  String IMPLICIT_ROLLBACK = "rollback";

  static <T> Success<T> success(T value) {
    return new Success<>(value);
  }

  static <T> RolledBack<T> rolledBack(Object reason) {
    return new RolledBack<>(reason);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /**
   * Returns the body's value.
   *
   * @throws IllegalStateException if the transaction was rolled back
   */
  default T value() {
    if (this instanceof Success<T> success) {
      return success.result();
    }
    throw new IllegalStateException("Transaction rolled back: " + ((RolledBack<T>) this).reason());
  }

  /**
   * @param result value returned by the body, may be {@code null}
   */
  record Success<T>(T result) implements TransactionOutcome<T> {
  }

  /**
   * @param reason the reason passed to {@code rollback}, a {@link ServerError}, or
   *               {@link #IMPLICIT_ROLLBACK}
   */
  record RolledBack<T>(Object reason) implements TransactionOutcome<T> {
    public RolledBack {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
