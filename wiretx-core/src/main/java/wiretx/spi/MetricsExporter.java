package wiretx.spi;

/**
 * Observability hook for exporting transaction counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of transactions that ended in {@code Success}.
   */
  void incrementCommitted();

  /**
   * Increments the count of transactions that ended in {@code RolledBack}.
   */
  void incrementRolledBack();

  /**
   * Increments the count of query-level or anchor savepoints rolled back to.
   */
  void incrementSavepointRolledBack();

  /**
   * Increments the count of failed {@code RELEASE SAVEPOINT} commands.
   */
  void incrementSavepointReleaseFailed();

  /**
   * Increments the count of commands answered locally because their transaction had failed.
   */
  default void incrementShortCircuited() {
  }

  /**
   * Increments the count of connections terminated by the disconnect policy.
   */
  void incrementDisconnects();

  /**
   * Increments the count of connections terminated by a transaction status mismatch.
   */
  void incrementProtocolViolations();

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCommitted() {
    }

    @Override
    public void incrementRolledBack() {
    }

    @Override
    public void incrementSavepointRolledBack() {
    }

    @Override
    public void incrementSavepointReleaseFailed() {
    }

    @Override
    public void incrementDisconnects() {
    }

    @Override
    public void incrementProtocolViolations() {
    }
  }
}
