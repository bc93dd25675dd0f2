package wiretx.error;

import wiretx.ServerError;

import java.util.Objects;

/**
 * Maps a server error to {@link ErrorClassification#LOCAL} or
 * {@link ErrorClassification#DISCONNECT} according to a {@link DisconnectPolicy}.
 */
public final class ErrorClassifier {
  private final DisconnectPolicy policy;

  public ErrorClassifier(DisconnectPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public ErrorClassification classify(ServerError error) {
    Objects.requireNonNull(error, "error");
    return classify(error.sqlState());
  }

  public ErrorClassification classify(String sqlState) {
    return policy.contains(sqlState) ? ErrorClassification.DISCONNECT : ErrorClassification.LOCAL;
  }

  public DisconnectPolicy policy() {
    return policy;
  }
}
