package wiretx.status;

import wiretx.ProtocolViolationException;
import wiretx.TransactionStatus;

import java.util.Objects;

/**
 * Result of comparing the believed transaction status with the one the server reported.
 */
public sealed interface StatusVerdict permits StatusVerdict.Consistent, StatusVerdict.Mismatch {

  Consistent CONSISTENT = new Consistent();

  default boolean isConsistent() {
    return this instanceof Consistent;
  }

  /**
   * Belief and server agree.
   */
  record Consistent() implements StatusVerdict {
  }

  /**
   * Belief and server disagree; the connection must be terminated.
   */
  record Mismatch(TransactionStatus expected, TransactionStatus observed) implements StatusVerdict {
    public Mismatch {
      Objects.requireNonNull(expected, "expected");
      Objects.requireNonNull(observed, "observed");
    }

    public ProtocolViolationException toException() {
      return new ProtocolViolationException(expected, observed);
    }
  }
}
