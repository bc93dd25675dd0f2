/**
 * Transaction execution: the per-connection command session, transaction contexts with their
 * failed-state short-circuit, and savepoint scopes.
 *
 * <p>{@link wiretx.tx.TransactionManager} drives {@code transaction()} calls;
 * {@link wiretx.tx.CommandSession} owns status verification and termination.
 */
package wiretx.tx;
