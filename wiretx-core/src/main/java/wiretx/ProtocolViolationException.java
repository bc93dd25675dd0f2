package wiretx;

import java.util.Objects;

/**
 * The server reported a transaction status that differs from the one the client expected.
 * Always fatal: the connection is terminated and pipelined commands can no longer be trusted.
 */
public class ProtocolViolationException extends RuntimeException {

  private final TransactionStatus expected;
  private final TransactionStatus observed;

  public ProtocolViolationException(TransactionStatus expected, TransactionStatus observed) {
    super("unexpected status: " + Objects.requireNonNull(observed, "observed").label());
    this.expected = Objects.requireNonNull(expected, "expected");
    this.observed = observed;
  }

  public TransactionStatus expected() {
    return expected;
  }

  public TransactionStatus observed() {
    return observed;
  }
}
