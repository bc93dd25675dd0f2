package wiretx.tx;

import wiretx.ConnectionTerminatedException;
import wiretx.ProtocolViolationException;
import wiretx.QueryOutcome;
import wiretx.ServerError;
import wiretx.ServerErrorException;
import wiretx.TransactionStatus;
import wiretx.error.ErrorClassification;
import wiretx.error.ErrorClassifier;
import wiretx.spi.CommandExecutor;
import wiretx.spi.ConnectionSupervisor;
import wiretx.spi.MetricsExporter;
import wiretx.status.CommandKind;
import wiretx.status.StatusTracker;
import wiretx.status.StatusVerdict;
import wiretx.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connection-owned state shared by every call on one logical connection: the status tracker,
 * the error classifier and the termination state.
 *
 * <p>Every round trip goes through {@link #execute(CommandKind, String, List)}, which
 * <ol>
 *   <li>refuses to send anything once the connection is terminated or terminating,</li>
 *   <li>verifies the server status before sending (a desync found here is fatal before the
 *       command leaves the client),</li>
 *   <li>verifies the status after the response and terminates on a mismatch, and</li>
 *   <li>schedules a termination for errors in the disconnect policy, after the error has been
 *       handed back to the caller.</li>
 * </ol>
 *
 * <p>Termination is delivered on two channels: the in-progress and every later call raise
 * {@link ConnectionTerminatedException}, and {@link #termination()} completes with the reason.
 * Both carry the identical reason instance.
 *
 * <p>Single command in flight: callers on one connection must be serialized by the
 * collaborator. Only the termination state is safe to read from other threads.
 */
public final class CommandSession implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CommandSession.class.getName());

  private final CommandExecutor executor;
  private final ConnectionSupervisor supervisor;
  private final StatusTracker tracker;
  private final ErrorClassifier classifier;
  private final MetricsExporter metrics;
  private final Executor terminationExecutor;

  private final AtomicReference<Throwable> terminationReason = new AtomicReference<>();
  private final CompletableFuture<Throwable> termination = new CompletableFuture<>();
  private volatile boolean closed;

  public CommandSession(CommandExecutor executor, ConnectionSupervisor supervisor,
      StatusTracker tracker, ErrorClassifier classifier, MetricsExporter metrics,
      Executor terminationExecutor) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.terminationExecutor = terminationExecutor != null
        ? terminationExecutor : Terminators.SHARED;
  }

  /**
   * Sends one command and verifies the server status afterwards.
   *
   * @return the command's outcome; server errors are returned, not thrown
   * @throws ConnectionTerminatedException if the connection is or becomes terminated
   */
  public QueryOutcome execute(CommandKind kind, String sql, List<?> params) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(sql, "sql");
    ensureOpen();
    verifyCurrentStatus();

    QueryOutcome outcome;
    try {
      outcome = executor.execute(sql, params == null ? List.of() : params);
    } catch (ConnectionTerminatedException e) {
      throw dropped(e);
    }

    StatusVerdict verdict = tracker.update(kind, !outcome.isSuccess(), readStatus());
    if (verdict instanceof StatusVerdict.Mismatch mismatch) {
      throw protocolViolation(mismatch.toException(), kind);
    }

    if (outcome instanceof QueryOutcome.Failure failure
        && classifier.classify(failure.error()) == ErrorClassification.DISCONNECT) {
      scheduleDisconnect(failure.error());
    }
    return outcome;
  }

  public QueryOutcome execute(CommandKind kind, String sql) {
    return execute(kind, sql, List.of());
  }

  /**
   * Verifies, without sending anything, that the server is still in the status the client
   * believes it to be in. Used on idle pings.
   *
   * @throws ConnectionTerminatedException on a mismatch or if already terminated
   */
  public void ping() {
    ensureOpen();
    verifyCurrentStatus();
  }

  public TransactionStatus believedStatus() {
    return tracker.believed();
  }

  /**
   * Returns {@code true} once a termination has been decided, even if the supervisor has not
   * closed the socket yet.
   */
  public boolean isTerminated() {
    return terminationReason.get() != null;
  }

  /**
   * Completes with the termination reason once the connection has been terminated.
   */
  public CompletionStage<Throwable> termination() {
    return termination.minimalCompletionStage();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      executor.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close command executor", e);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Connection closed");
    }
    Throwable reason = terminationReason.get();
    if (reason != null) {
      throw terminated(reason);
    }
  }

  private TransactionStatus readStatus() {
    try {
      return executor.currentStatus();
    } catch (ConnectionTerminatedException e) {
      throw dropped(e);
    }
  }

  // the collaborator dropped the socket
  private ConnectionTerminatedException dropped(ConnectionTerminatedException e) {
    Throwable reason = recordTermination(e.reason());
    termination.complete(reason);
    return terminated(reason);
  }

  private void verifyCurrentStatus() {
    StatusVerdict verdict = tracker.verify(readStatus());
    if (verdict instanceof StatusVerdict.Mismatch mismatch) {
      throw protocolViolation(mismatch.toException(), null);
    }
  }

  private ConnectionTerminatedException protocolViolation(ProtocolViolationException violation,
      CommandKind kind) {
    Throwable reason = recordTermination(violation);
    if (reason == violation) {
      metrics.incrementProtocolViolations();
      logger.log(Level.SEVERE, (kind != null ? "After " + kind + ": " : "")
          + violation.getMessage() + " (expected " + violation.expected().label()
          + "), terminating connection");
      requestTermination(reason);
    }
    termination.complete(reason);
    return terminated(reason);
  }

  private void scheduleDisconnect(ServerError error) {
    ServerErrorException reason = new ServerErrorException(error);
    if (recordTermination(reason) != reason) {
      return;
    }
    metrics.incrementDisconnects();
    terminationExecutor.execute(() -> {
      logger.log(Level.SEVERE, "disconnected: " + reason.getClass().getName() + ": " + error);
      requestTermination(reason);
      termination.complete(reason);
    });
  }

  private void requestTermination(Throwable reason) {
    try {
      supervisor.requestTermination(reason);
    } catch (RuntimeException e) {
      reason.addSuppressed(e);
      logger.log(Level.WARNING, "Connection supervisor failed to terminate connection", e);
    }
  }

  /**
   * Records the first termination reason; later reasons lose and the winner is returned.
   */
  private Throwable recordTermination(Throwable reason) {
    if (terminationReason.compareAndSet(null, reason)) {
      return reason;
    }
    return terminationReason.get();
  }

  private static ConnectionTerminatedException terminated(Throwable reason) {
    return new ConnectionTerminatedException(reason);
  }

  private static final class Terminators {
    static final ExecutorService SHARED =
        Executors.newCachedThreadPool(new DaemonThreadFactory("wiretx-terminator-"));

    private Terminators() {}
  }
}
