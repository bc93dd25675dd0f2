package wiretx.tx;

/**
 * Unwinds a transaction body to its {@code transaction()} call after
 * {@link wiretx.TransactionHandle#rollback(Object)}.
 */
final class RollbackSignal extends RuntimeException {
  private final transient TransactionContext context;
  private final transient Object reason;

  RollbackSignal(TransactionContext context, Object reason) {
    super("rollback: " + reason, null, false, false);
    this.context = context;
    this.reason = reason;
  }

  TransactionContext context() {
    return context;
  }

  Object reason() {
    return reason;
  }
}
