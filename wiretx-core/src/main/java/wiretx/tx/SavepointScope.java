package wiretx.tx;

import wiretx.QueryOutcome;
import wiretx.spi.MetricsExporter;
import wiretx.status.CommandKind;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a unit of work as a nested, independently rollback-able segment of a transaction using
 * {@code SAVEPOINT} / {@code ROLLBACK TO SAVEPOINT} / {@code RELEASE SAVEPOINT}.
 *
 * <p>On exit the savepoint is always released, also after rolling back to it. If the release
 * fails, the rollback boundary could not be re-established: the failure replaces the unit's
 * result and fails the parent context. Exactly one of unit success, unit error and release
 * failure is returned.
 */
final class SavepointScope {
  private static final Logger logger = Logger.getLogger(SavepointScope.class.getName());

  private final CommandSession session;
  private final MetricsExporter metrics;

  SavepointScope(CommandSession session, MetricsExporter metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Wraps a single command in a savepoint.
   *
   * @param parent context the command belongs to
   * @param name   savepoint name
   * @param unit   the command; must not fail {@code parent} itself
   * @return the unit's outcome, or the savepoint's own failure
   */
  QueryOutcome run(TransactionContext parent, String name, Supplier<QueryOutcome> unit) {
    SavepointFrame frame = open(parent, name);
    if (frame.openError() != null) {
      return QueryOutcome.failure(frame.openError());
    }
    // an inactive frame still runs the unit, which fails fast on the failed parent
    QueryOutcome outcome = unit.get();
    if (session.isTerminated()) {
      // the unit's error decided a disconnect: hand it back without further round trips
      return outcome;
    }
    Optional<QueryOutcome.Failure> releaseFailure = close(frame, !outcome.isSuccess());
    if (releaseFailure.isPresent()) {
      return releaseFailure.get();
    }
    return outcome;
  }

  /**
   * Sends {@code SAVEPOINT name} unless the parent has already failed, in which case the
   * command would be rejected by the server anyway.
   */
  SavepointFrame open(TransactionContext parent, String name) {
    if (parent != null && parent.isFailed()) {
      return SavepointFrame.skipped(name, parent);
    }
    QueryOutcome outcome = session.execute(CommandKind.SAVEPOINT, "SAVEPOINT " + name);
    if (!outcome.isSuccess()) {
      if (parent != null) {
        parent.markFailed();
      }
      return SavepointFrame.unopened(name, parent, outcome.error());
    }
    return SavepointFrame.opened(name, parent);
  }

  /**
   * Leaves the savepoint: rolls back to it if the unit failed, then releases it.
   *
   * @param frame      the frame returned by {@link #open(TransactionContext, String)}
   * @param rollBack   whether to roll back to the savepoint before releasing it
   * @return the release failure, if releasing did not succeed
   */
  Optional<QueryOutcome.Failure> close(SavepointFrame frame, boolean rollBack) {
    if (!frame.isActive() || frame.isReleased()) {
      return Optional.empty();
    }
    if (rollBack) {
      // the outcome does not matter: if this fails, so does the release below
      session.execute(CommandKind.ROLLBACK_TO_SAVEPOINT, "ROLLBACK TO SAVEPOINT " + frame.name());
      metrics.incrementSavepointRolledBack();
    }
    QueryOutcome release = session.execute(CommandKind.RELEASE_SAVEPOINT,
        "RELEASE SAVEPOINT " + frame.name());
    if (release.isSuccess()) {
      frame.markReleased();
      return Optional.empty();
    }
    metrics.incrementSavepointReleaseFailed();
    logger.log(Level.WARNING, "Failed to release savepoint " + frame.name() + ": " + release.error());
    TransactionContext parent = frame.parent();
    if (parent != null) {
      parent.markFailed();
    }
    return Optional.of(QueryOutcome.failure(release.error(), QueryOutcome.FailureKind.SAVEPOINT_RELEASE));
  }
}
