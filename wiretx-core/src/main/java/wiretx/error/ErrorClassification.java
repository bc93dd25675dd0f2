package wiretx.error;

/**
 * What a server error means for the connection.
 */
public enum ErrorClassification {
  /** Returned to the caller; fails the enclosing transaction, if any. */
  LOCAL,
  /** Returned to the caller, then the connection is terminated. */
  DISCONNECT
}
