package wiretx;

import java.util.Objects;

/**
 * Caller-visible result of a single query: either a {@link Success} carrying the rows, or a
 * {@link Failure} carrying the error.
 *
 * <p>Abrupt connection termination is never represented here; it is raised as
 * {@link ConnectionTerminatedException}.
 */
public sealed interface QueryOutcome permits QueryOutcome.Success, QueryOutcome.Failure {

  static Success success(QueryResult result) {
    return new Success(result);
  }

  static Failure failure(ServerError error) {
    return new Failure(error, FailureKind.SERVER);
  }

  static Failure failure(ServerError error, FailureKind kind) {
    return new Failure(error, kind);
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }

  /**
   * Returns the query result or throws the error as a {@link ServerErrorException}.
   */
  default QueryResult orElseThrow() {
    if (this instanceof Success success) {
      return success.result();
    }
    throw new ServerErrorException(((Failure) this).error());
  }

  /**
   * Returns the error of a failed outcome.
   *
   * @throws IllegalStateException if the outcome is a success
   */
  default ServerError error() {
    if (this instanceof Failure failure) {
      return failure.error();
    }
    throw new IllegalStateException("Query succeeded");
  }

  /** Where a failure came from. */
  enum FailureKind {
    /** The server rejected the command. */
    SERVER,
    /** Rejected locally because the enclosing transaction had already failed. */
    IN_FAILED_TRANSACTION,
    /** The command succeeded or failed, but releasing its savepoint did not succeed. */
    SAVEPOINT_RELEASE
  }

  record Success(QueryResult result) implements QueryOutcome {
    public Success {
      Objects.requireNonNull(result, "result");
    }
  }

  record Failure(ServerError error, FailureKind kind) implements QueryOutcome {
    public Failure {
      Objects.requireNonNull(error, "error");
      Objects.requireNonNull(kind, "kind");
    }
  }
}
