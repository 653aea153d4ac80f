package io.codesync.eviction;

import io.codesync.metrics.SyncMetrics;
import io.codesync.persistence.PersistenceScheduler;
import io.codesync.registry.ReplicaEntry;
import io.codesync.registry.ReplicaRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background job that periodically drops replicas nobody is editing:
 * no attached connections and no access for longer than the inactivity timeout.
 * <p>
 * Each candidate is flushed first; the registry then re-checks, under the document
 * lock, that it is still unattached and clean before removing it. A connection that
 * arrives during the flush therefore keeps the replica alive.
 */
@Slf4j
public final class EvictionSweeper implements AutoCloseable {
    private final ReplicaRegistry registry;
    private final PersistenceScheduler persistence;
    private final SyncMetrics metrics;
    private final long inactivityMillis;
    private final long intervalMillis;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "eviction-sweeper");
        t.setDaemon(true);
        return t;
    });

    public EvictionSweeper(final ReplicaRegistry registry,
                           final PersistenceScheduler persistence,
                           final SyncMetrics metrics,
                           final Duration inactivityTimeout,
                           final Duration interval) {
        this.registry = registry;
        this.persistence = persistence;
        this.metrics = metrics;
        this.inactivityMillis = inactivityTimeout.toMillis();
        this.intervalMillis = interval.toMillis();
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Eviction sweeper started (interval {} ms, inactivity timeout {} ms)", intervalMillis, inactivityMillis);
    }

    /**
     * Runs one pass against the current time.
     *
     * @return number of replicas evicted
     */
    public int sweep() {
        return sweep(System.currentTimeMillis());
    }

    int sweep(final long now) {
        int evicted = 0;

        for (final ReplicaEntry entry : registry.entries()) {
            if (entry.attachedCount() > 0) continue;
            if (now - entry.getLastAccess() <= inactivityMillis) continue;

            if (!persistence.flushNow(entry.getKey())) {
                log.warn("Keeping {} in memory: flush before eviction failed", entry.getKey());
                continue;
            }

            if (registry.remove(entry.getKey())) {
                evicted++;
            } else {
                log.debug("Kept {}: reattached or modified during flush", entry.getKey());
            }
        }

        if (evicted > 0) {
            log.info("Sweep evicted {} replica(s), {} resident", evicted, registry.size());
        }
        log.debug("Sweep done: {}", metrics);
        return evicted;
    }

    /* A throw would cancel the periodic task. */
    private void sweepSafely() {
        try {
            sweep();
        } catch (final RuntimeException e) {
            log.error("Eviction sweep failed", e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
