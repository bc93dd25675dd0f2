package wiretx;

/**
 * Wraps a checked exception thrown by a {@link TransactionCallback}. The transaction has been
 * rolled back by the time this is thrown.
 */
public final class TransactionBodyException extends RuntimeException {
  public TransactionBodyException(Throwable cause) {
    super(cause.getMessage(), cause);
  }
}
