package wiretx.status;

/**
 * Category of a command as issued by the transaction core. Determines the status the server
 * is expected to report afterwards.
 *
 * <p>SQL sent by callers is always {@link #STATEMENT}, whatever its text: a caller sending
 * {@code BEGIN} through a plain query changes the server status behind the core's back, and
 * that is exactly what the tracker must catch.
 */
public enum CommandKind {
  BEGIN,
  COMMIT,
  ROLLBACK,
  SAVEPOINT,
  RELEASE_SAVEPOINT,
  ROLLBACK_TO_SAVEPOINT,
  STATEMENT
}
