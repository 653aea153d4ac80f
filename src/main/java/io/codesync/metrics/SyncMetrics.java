package io.codesync.metrics;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * JVM-local counters for the synchronization service. Thread-safe.
 * <p>
 * Gauges (attached connections, resident replicas) are read on demand from whichever
 * component owns the value; see {@link #registerGauge(String, LongSupplier)}.
 */
public final class SyncMetrics {

    public static final String ATTACHED_CONNECTIONS = "attachedConnections";
    public static final String RESIDENT_REPLICAS = "residentReplicas";

    private final AtomicLong connectionsAccepted = new AtomicLong();
    private final AtomicLong connectionsRejected = new AtomicLong();
    private final AtomicLong updatesApplied = new AtomicLong();
    private final AtomicLong updatesMalformed = new AtomicLong();
    private final AtomicLong writesSucceeded = new AtomicLong();
    private final AtomicLong writesFailed = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private final Map<String, LongSupplier> gauges = new ConcurrentHashMap<>();

    public void registerGauge(final String name, final LongSupplier value) {
        gauges.put(name, value);
    }

    public long gauge(final String name) {
        final LongSupplier s = gauges.get(name);
        return s == null ? 0L : s.getAsLong();
    }

    public void connectionAccepted() {
        connectionsAccepted.incrementAndGet();
    }

    public void connectionRejected() {
        connectionsRejected.incrementAndGet();
    }

    public void updateApplied() {
        updatesApplied.incrementAndGet();
    }

    public void updateMalformed() {
        updatesMalformed.incrementAndGet();
    }

    public void writeSucceeded() {
        writesSucceeded.incrementAndGet();
    }

    public void writeFailed() {
        writesFailed.incrementAndGet();
    }

    public void loadFailed() {
        loadFailures.incrementAndGet();
    }

    public void evicted() {
        evictions.incrementAndGet();
    }

    public long connectionsAccepted() {
        return connectionsAccepted.get();
    }

    public long connectionsRejected() {
        return connectionsRejected.get();
    }

    public long updatesApplied() {
        return updatesApplied.get();
    }

    public long updatesMalformed() {
        return updatesMalformed.get();
    }

    public long writesSucceeded() {
        return writesSucceeded.get();
    }

    public long writesFailed() {
        return writesFailed.get();
    }

    public long loadFailures() {
        return loadFailures.get();
    }

    public long evictions() {
        return evictions.get();
    }

    @Override
    public String toString() {
        return "SyncMetrics{" +
                "attachedConnections=" + gauge(ATTACHED_CONNECTIONS) +
                ", residentReplicas=" + gauge(RESIDENT_REPLICAS) +
                ", connectionsAccepted=" + connectionsAccepted.get() +
                ", connectionsRejected=" + connectionsRejected.get() +
                ", updatesApplied=" + updatesApplied.get() +
                ", updatesMalformed=" + updatesMalformed.get() +
                ", writesSucceeded=" + writesSucceeded.get() +
                ", writesFailed=" + writesFailed.get() +
                ", loadFailures=" + loadFailures.get() +
                ", evictions=" + evictions.get() +
                '}';
    }
}
