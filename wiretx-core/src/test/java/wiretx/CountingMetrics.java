package wiretx;

import wiretx.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

public class CountingMetrics implements MetricsExporter {
    public final AtomicInteger committed = new AtomicInteger();
    public final AtomicInteger rolledBack = new AtomicInteger();
    public final AtomicInteger savepointRolledBack = new AtomicInteger();
    public final AtomicInteger savepointReleaseFailed = new AtomicInteger();
    public final AtomicInteger shortCircuited = new AtomicInteger();
    public final AtomicInteger disconnects = new AtomicInteger();
    public final AtomicInteger protocolViolations = new AtomicInteger();

    @Override
    public void incrementCommitted() {
        committed.incrementAndGet();
    }

    @Override
    public void incrementRolledBack() {
        rolledBack.incrementAndGet();
    }

    @Override
    public void incrementSavepointRolledBack() {
        savepointRolledBack.incrementAndGet();
    }

    @Override
    public void incrementSavepointReleaseFailed() {
        savepointReleaseFailed.incrementAndGet();
    }

    @Override
    public void incrementShortCircuited() {
        shortCircuited.incrementAndGet();
    }

    @Override
    public void incrementDisconnects() {
        disconnects.incrementAndGet();
    }

    @Override
    public void incrementProtocolViolations() {
        protocolViolations.incrementAndGet();
    }
}
