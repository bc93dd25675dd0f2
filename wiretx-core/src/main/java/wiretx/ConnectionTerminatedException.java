package wiretx;

import java.util.Objects;

/**
 * Raised to every caller waiting on a connection once it has been terminated.
 *
 * <p>All instances raised for one connection carry the identical {@linkplain #reason() reason}:
 * a {@link ProtocolViolationException} for a status desync, a {@link ServerErrorException} for
 * an error in the disconnect policy, or the collaborator's own failure if the socket dropped.
 */
public class ConnectionTerminatedException extends RuntimeException {

  private final Throwable reason;

  public ConnectionTerminatedException(Throwable reason) {
    super("Connection terminated: " + Objects.requireNonNull(reason, "reason").getMessage(), reason);
    this.reason = reason;
  }

  public Throwable reason() {
    return reason;
  }
}
