package wiretx.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import wiretx.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code wiretx.tx.committed}: transactions committed, or naive anchors released</li>
 *   <li>{@code wiretx.tx.rolled_back}: transactions rolled back, explicitly or implicitly</li>
 *   <li>{@code wiretx.savepoint.rolled_back}: rollbacks to a savepoint</li>
 *   <li>{@code wiretx.savepoint.release_failed}: failed {@code RELEASE SAVEPOINT} commands</li>
 *   <li>{@code wiretx.query.short_circuited}: commands answered locally in a failed transaction</li>
 *   <li>{@code wiretx.connection.disconnects}: terminations by the disconnect policy</li>
 *   <li>{@code wiretx.connection.protocol_violations}: terminations by a status mismatch</li>
 * </ul>
 *
 * <p>One exporter is usually shared by all connections of an application.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter committed;
  private final Counter rolledBack;
  private final Counter savepointRolledBack;
  private final Counter savepointReleaseFailed;
  private final Counter shortCircuited;
  private final Counter disconnects;
  private final Counter protocolViolations;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "wiretx"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "wiretx");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.committed = counter(namePrefix + ".tx.committed", "Transactions committed");
    this.rolledBack = counter(namePrefix + ".tx.rolled_back", "Transactions rolled back");
    this.savepointRolledBack = counter(namePrefix + ".savepoint.rolled_back",
        "Rollbacks to a savepoint");
    this.savepointReleaseFailed = counter(namePrefix + ".savepoint.release_failed",
        "Savepoints that could not be released");
    this.shortCircuited = counter(namePrefix + ".query.short_circuited",
        "Commands rejected locally in a failed transaction");
    this.disconnects = counter(namePrefix + ".connection.disconnects",
        "Connections terminated by the disconnect policy");
    this.protocolViolations = counter(namePrefix + ".connection.protocol_violations",
        "Connections terminated by a transaction status mismatch");
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementCommitted() {
    if (closed) return;
    committed.increment();
  }

  @Override
  public void incrementRolledBack() {
    if (closed) return;
    rolledBack.increment();
  }

  @Override
  public void incrementSavepointRolledBack() {
    if (closed) return;
    savepointRolledBack.increment();
  }

  @Override
  public void incrementSavepointReleaseFailed() {
    if (closed) return;
    savepointReleaseFailed.increment();
  }

  @Override
  public void incrementShortCircuited() {
    if (closed) return;
    shortCircuited.increment();
  }

  @Override
  public void incrementDisconnects() {
    if (closed) return;
    disconnects.increment();
  }

  @Override
  public void incrementProtocolViolations() {
    if (closed) return;
    protocolViolations.increment();
  }

  /**
   * Removes the meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(committed, rolledBack, savepointRolledBack, savepointReleaseFailed,
        shortCircuited, disconnects, protocolViolations)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
