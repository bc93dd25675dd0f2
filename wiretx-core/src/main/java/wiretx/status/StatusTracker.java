package wiretx.status;

import wiretx.TransactionStatus;

import java.util.Objects;

/**
 * Holds the client's belief about the server transaction status and verifies it after every
 * round trip.
 *
 * <p>The expected status is derived from the kind of command just issued and whether it
 * failed:
 * <ul>
 *   <li>{@code BEGIN} → {@code IN_TRANSACTION}; on error the status does not move</li>
 *   <li>{@code COMMIT}, {@code ROLLBACK} → {@code IDLE}, also on error</li>
 *   <li>{@code SAVEPOINT}, {@code RELEASE}, {@code ROLLBACK TO} → {@code IN_TRANSACTION};
 *       on error {@code FAILED}</li>
 *   <li>statements → unchanged; on error {@code FAILED}, unless the session was idle, in which
 *       case the failed statement was its own implicit transaction and the session stays
 *       {@code IDLE}</li>
 * </ul>
 *
 * <p>A tracker in lenient mode adopts whatever status the server reports. The naive strategy
 * uses it because the caller opens and closes the outer transaction with plain statements.
 *
 * <p>Not thread-safe; owned by a single connection session.
 */
public final class StatusTracker {
  private final boolean lenient;
  private TransactionStatus believed;

  public StatusTracker(boolean lenient) {
    this(lenient, TransactionStatus.IDLE);
  }

  public StatusTracker(boolean lenient, TransactionStatus initial) {
    this.lenient = lenient;
    this.believed = Objects.requireNonNull(initial, "initial");
  }

  /**
   * Returns the status the client currently believes the server to be in.
   */
  public TransactionStatus believed() {
    return believed;
  }

  public boolean isLenient() {
    return lenient;
  }

  /**
   * Computes the status the server should report after {@code kind} completed.
   */
  public TransactionStatus expectedAfter(CommandKind kind, boolean errored) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case BEGIN -> errored ? believed : TransactionStatus.IN_TRANSACTION;
      case COMMIT, ROLLBACK -> TransactionStatus.IDLE;
      case SAVEPOINT, RELEASE_SAVEPOINT, ROLLBACK_TO_SAVEPOINT ->
          errored ? TransactionStatus.FAILED : TransactionStatus.IN_TRANSACTION;
      case STATEMENT -> {
        if (!errored) {
          yield believed;
        }
        yield believed == TransactionStatus.IDLE ? TransactionStatus.IDLE : TransactionStatus.FAILED;
      }
    };
  }

  /**
   * Records the status observed after a round trip and checks it against the expectation.
   * On a mismatch the belief is left untouched: the connection is about to be terminated.
   *
   * @param kind     category of the command just completed
   * @param errored  whether the command returned an error
   * @param observed status carried on the server's response
   * @return {@link StatusVerdict#CONSISTENT} or a mismatch
   */
  public StatusVerdict update(CommandKind kind, boolean errored, TransactionStatus observed) {
    Objects.requireNonNull(observed, "observed");
    if (lenient) {
      believed = observed;
      return StatusVerdict.CONSISTENT;
    }
    TransactionStatus expected = expectedAfter(kind, errored);
    if (expected != observed) {
      return new StatusVerdict.Mismatch(expected, observed);
    }
    believed = observed;
    return StatusVerdict.CONSISTENT;
  }

  /**
   * Checks the current server status against the belief without a command having been sent,
   * e.g. before a command is issued or on an idle ping.
   */
  public StatusVerdict verify(TransactionStatus observed) {
    Objects.requireNonNull(observed, "observed");
    if (lenient) {
      believed = observed;
      return StatusVerdict.CONSISTENT;
    }
    if (observed != believed) {
      return new StatusVerdict.Mismatch(believed, observed);
    }
    return StatusVerdict.CONSISTENT;
  }
}
