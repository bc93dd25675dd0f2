package wiretx;

import java.util.Objects;

/**
 * Unchecked wrapper for a {@link ServerError}, used where an error has to travel as an
 * exception: as the reason of a disconnect and by {@link QueryOutcome#orElseThrow()}.
 */
public class ServerErrorException extends RuntimeException {

  private final ServerError error;

  public ServerErrorException(ServerError error) {
    super(Objects.requireNonNull(error, "error").toString());
    this.error = error;
  }

  public ServerError error() {
    return error;
  }
}
