package wiretx;

/**
 * Unit of work executed inside {@link WireConnection#transaction(TransactionCallback)}.
 *
 * @param <T> the value produced by the body
 */
@FunctionalInterface
public interface TransactionCallback<T> {

  /**
   * Runs the body. Returning commits; calling {@link TransactionHandle#rollback(Object)} rolls
   * back; throwing rolls back and propagates the exception.
   *
   * @param tx handle for issuing queries within this transaction
   * @return the value reported in {@link TransactionOutcome.Success}
   * @throws Exception any failure of the body
   */
  T doInTransaction(TransactionHandle tx) throws Exception;
}
