package wiretx.tx;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import wiretx.ConnectionTerminatedException;
import wiretx.CountingMetrics;
import wiretx.FakeServer;
import wiretx.ProtocolViolationException;
import wiretx.QueryOptions;
import wiretx.QueryOutcome;
import wiretx.RecordingSupervisor;
import wiretx.ServerErrorException;
import wiretx.SqlState;
import wiretx.TransactionConfig;
import wiretx.TransactionStatus;
import wiretx.WireConnection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerminationTest {

    private FakeServer server;
    private RecordingSupervisor supervisor;
    private CountingMetrics metrics;

    @BeforeEach
    void setUp() {
        server = new FakeServer();
        supervisor = new RecordingSupervisor(server);
        metrics = new CountingMetrics();
    }

    private WireConnection connect(TransactionConfig config, Executor terminationExecutor) {
        WireConnection.Builder builder = WireConnection.builder()
                .executor(server)
                .supervisor(supervisor)
                .config(config)
                .metrics(metrics);
        if (terminationExecutor != null) {
            builder.terminationExecutor(terminationExecutor);
        }
        return builder.build();
    }

    private static TransactionConfig disconnectOnReadOnly() {
        return new TransactionConfig().setDisconnectOnErrorCodes(List.of("read_only_sql_transaction"));
    }

    // ── Disconnect policy ───────────────────────────────────────────

    @Test
    void errorIsReturnedBeforeConnectionIsTerminated() {
        List<Runnable> pending = new ArrayList<>();
        WireConnection conn = connect(disconnectOnReadOnly(), pending::add);
        AtomicReference<QueryOutcome> readOnly = new AtomicReference<>();

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class, () ->
                conn.transaction(tx -> {
                    tx.query("SET TRANSACTION READ ONLY").orElseThrow();
                    readOnly.set(tx.query("INSERT INTO uniques VALUES (1)"));
                    // decided but not yet carried out
                    assertTrue(conn.isTerminated());
                    assertTrue(supervisor.reasons().isEmpty());
                    assertEquals(1, pending.size());
                    return "hi";
                }));

        assertEquals(SqlState.READ_ONLY_SQL_TRANSACTION, readOnly.get().error().sqlState());
        ServerErrorException reason = assertInstanceOf(ServerErrorException.class, thrown.reason());
        assertEquals(SqlState.READ_ONLY_SQL_TRANSACTION, reason.error().sqlState());
        // no ROLLBACK is sent on a connection that is going away
        assertEquals(0, server.count("ROLLBACK"));
        assertFalse(conn.termination().toCompletableFuture().isDone());

        pending.forEach(Runnable::run);

        assertEquals(List.of(reason), supervisor.reasons());
        assertSame(reason, conn.termination().toCompletableFuture().join());
        assertEquals(1, metrics.disconnects.get());
    }

    @Test
    void disconnectRunsOnBackgroundThreadByDefault() throws Exception {
        WireConnection conn = connect(disconnectOnReadOnly(), null);
        AtomicReference<QueryOutcome> readOnly = new AtomicReference<>();

        assertThrows(ConnectionTerminatedException.class, () ->
                conn.transaction(tx -> {
                    tx.query("SET TRANSACTION READ ONLY").orElseThrow();
                    readOnly.set(tx.query("INSERT INTO uniques VALUES (1)"));
                    assertTrue(supervisor.awaitTermination(5, TimeUnit.SECONDS));
                    return null;
                }));

        assertEquals(SqlState.READ_ONLY_SQL_TRANSACTION, readOnly.get().error().sqlState());
        Throwable reason = conn.termination().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertInstanceOf(ServerErrorException.class, reason);
        assertSame(reason, supervisor.reasons().get(0));
        assertSame(reason, assertThrows(ConnectionTerminatedException.class,
                () -> conn.query("SELECT 1")).reason());
    }

    @Test
    void disconnectErrorInsideSavepointQueryReachesCaller() {
        List<Runnable> pending = new ArrayList<>();
        WireConnection conn = connect(disconnectOnReadOnly(), pending::add);
        AtomicReference<QueryOutcome> guarded = new AtomicReference<>();

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class, () ->
                conn.transaction(tx -> {
                    tx.query("SET TRANSACTION READ ONLY").orElseThrow();
                    guarded.set(tx.query("INSERT INTO uniques VALUES (1)", List.of(),
                            QueryOptions.withSavepoint()));
                    return "hi";
                }));

        QueryOutcome.Failure failure = (QueryOutcome.Failure) guarded.get();
        assertEquals(SqlState.READ_ONLY_SQL_TRANSACTION, failure.error().sqlState());
        assertEquals(QueryOutcome.FailureKind.SERVER, failure.kind());
        // neither ROLLBACK TO nor RELEASE is attempted on a connection that is going away
        assertEquals(List.of(
                "BEGIN",
                "SET TRANSACTION READ ONLY",
                "SAVEPOINT wiretx_query",
                "INSERT INTO uniques VALUES (1)"), server.log());
        assertInstanceOf(ServerErrorException.class, thrown.reason());

        pending.forEach(Runnable::run);

        assertSame(thrown.reason(), conn.termination().toCompletableFuture().join());
        assertEquals(List.of(thrown.reason()), supervisor.reasons());
    }

    @Test
    void disconnectCodesMayBeGivenNumerically() {
        WireConnection conn = connect(new TransactionConfig().setDisconnectOnErrorCodes(List.of("25006")),
                Runnable::run);

        assertThrows(ConnectionTerminatedException.class, () ->
                conn.transaction(tx -> {
                    tx.query("SET TRANSACTION READ ONLY");
                    return tx.query("INSERT INTO uniques VALUES (1)");
                }));

        assertEquals(1, supervisor.reasons().size());
        assertTrue(conn.isTerminated());
    }

    @Test
    void errorsOutsideThePolicyAreLocal() {
        WireConnection conn = connect(disconnectOnReadOnly(), Runnable::run);

        conn.transaction(tx -> tx.query("INSERT INTO uniques VALUES (1), (1)"));

        assertFalse(conn.isTerminated());
        assertTrue(supervisor.reasons().isEmpty());
        assertTrue(conn.query("SELECT 1").isSuccess());
    }

    @Test
    void bodyExceptionAfterDisconnectSkipsRollback() {
        WireConnection conn = connect(disconnectOnReadOnly(), Runnable::run);
        IllegalArgumentException boom = new IllegalArgumentException("boom");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () ->
                conn.transaction(tx -> {
                    tx.query("SET TRANSACTION READ ONLY");
                    tx.query("INSERT INTO uniques VALUES (1)");
                    throw boom;
                }));

        assertSame(boom, thrown);
        assertEquals(0, thrown.getSuppressed().length);
        assertEquals(0, server.count("ROLLBACK"));
    }

    // ── Status desync ───────────────────────────────────────────────

    @Test
    void plainBeginTerminatesStrictConnection() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class,
                () -> conn.query("BEGIN"));

        ProtocolViolationException violation = assertInstanceOf(ProtocolViolationException.class, thrown.reason());
        assertEquals("unexpected status: in_transaction", violation.getMessage());
        assertEquals(TransactionStatus.IDLE, violation.expected());
        assertEquals(TransactionStatus.IN_TRANSACTION, violation.observed());
        assertEquals(List.of(violation), supervisor.reasons());
        assertSame(violation, conn.termination().toCompletableFuture().join());
        assertEquals(1, metrics.protocolViolations.get());
    }

    @Test
    void plainRollbackInsideTransactionTerminates() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class, () ->
                conn.transaction(tx -> {
                    try {
                        tx.query("ROLLBACK");
                    } catch (ConnectionTerminatedException e) {
                        // swallowing it does not let the transaction complete
                    }
                    return "hi";
                }));

        assertEquals("unexpected status: idle", thrown.reason().getMessage());
        assertTrue(conn.isTerminated());
        assertEquals(0, server.count("COMMIT"));
    }

    @Test
    void desyncIsDetectedBeforeSending() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);
        server.forceStatus(TransactionStatus.IN_TRANSACTION);

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class,
                () -> conn.query("SELECT 42"));

        assertEquals("unexpected status: in_transaction", thrown.reason().getMessage());
        assertTrue(server.log().isEmpty());
    }

    @Test
    void pingDetectsDesync() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);
        conn.ping();

        server.forceStatus(TransactionStatus.FAILED);

        ConnectionTerminatedException thrown = assertThrows(ConnectionTerminatedException.class, conn::ping);
        assertEquals("unexpected status: failed", thrown.reason().getMessage());
        assertEquals(1, supervisor.reasons().size());
    }

    @Test
    void initialStatusIsTrusted() {
        server.forceStatus(TransactionStatus.IN_TRANSACTION);
        WireConnection conn = WireConnection.builder()
                .executor(server)
                .supervisor(supervisor)
                .initialStatus(TransactionStatus.IN_TRANSACTION)
                .build();

        conn.ping();
        assertTrue(conn.query("SELECT 1").isSuccess());
        assertEquals(TransactionStatus.IN_TRANSACTION, conn.status());
        assertFalse(conn.isTerminated());
    }

    // ── Abrupt drop ─────────────────────────────────────────────────

    @Test
    void everyCallerSeesTheSameReason() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);
        AtomicReference<Throwable> observed = new AtomicReference<>();
        conn.termination().thenAccept(observed::set);

        server.drop();

        Throwable first = assertThrows(ConnectionTerminatedException.class, () -> conn.query("SELECT 1")).reason();
        Throwable second = assertThrows(ConnectionTerminatedException.class, () -> conn.query("SELECT 2")).reason();
        Throwable third = assertThrows(ConnectionTerminatedException.class,
                () -> conn.transaction(tx -> "never")).reason();

        assertInstanceOf(IOException.class, first);
        assertSame(first, second);
        assertSame(first, third);
        assertSame(first, observed.get());
    }

    @Test
    void dropWhileReadingStatusAfterCommandIsRecorded() {
        StatusDroppingServer dropping = new StatusDroppingServer();
        WireConnection conn = WireConnection.builder()
                .executor(dropping)
                .supervisor(new RecordingSupervisor(dropping))
                .terminationExecutor(Runnable::run)
                .build();
        // the check before sending passes, the read after the response fails
        dropping.dropStatusAfter(1);

        Throwable first = assertThrows(ConnectionTerminatedException.class,
                () -> conn.query("SELECT 42")).reason();

        assertInstanceOf(IOException.class, first);
        assertEquals(List.of("SELECT 42"), dropping.log());
        assertTrue(conn.isTerminated());
        assertSame(first, conn.termination().toCompletableFuture().getNow(null));
        assertSame(first, assertThrows(ConnectionTerminatedException.class,
                () -> conn.query("SELECT 1")).reason());
    }

    @Test
    void dropWhileVerifyingStatusBeforeSendingIsRecorded() {
        StatusDroppingServer dropping = new StatusDroppingServer();
        WireConnection conn = WireConnection.builder()
                .executor(dropping)
                .supervisor(new RecordingSupervisor(dropping))
                .terminationExecutor(Runnable::run)
                .build();
        dropping.dropStatusAfter(0);

        Throwable reason = assertThrows(ConnectionTerminatedException.class, conn::ping).reason();

        assertInstanceOf(IOException.class, reason);
        assertTrue(conn.isTerminated());
        assertSame(reason, conn.termination().toCompletableFuture().getNow(null));
        assertTrue(dropping.log().isEmpty());
    }

    @Test
    void closedConnectionRejectsCommands() {
        WireConnection conn = connect(new TransactionConfig(), Runnable::run);

        conn.close();

        assertTrue(server.isClosed());
        assertThrows(IllegalStateException.class, () -> conn.query("SELECT 1"));
    }

    /**
     * Loses the socket while the transaction status is being read.
     */
    private static final class StatusDroppingServer extends FakeServer {
        private int readsBeforeDrop = -1;

        void dropStatusAfter(int reads) {
            this.readsBeforeDrop = reads;
        }

        @Override
        public TransactionStatus currentStatus() {
            if (readsBeforeDrop == 0) {
                throw new ConnectionTerminatedException(new IOException("connection reset by peer"));
            }
            if (readsBeforeDrop > 0) {
                readsBeforeDrop--;
            }
            return super.currentStatus();
        }
    }
}
