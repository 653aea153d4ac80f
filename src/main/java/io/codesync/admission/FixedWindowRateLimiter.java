package io.codesync.admission;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * At most {@code maxAttempts} connection attempts per client address per fixed window.
 * <p>
 * Windows start at the first attempt from an address and reset once they elapse.
 * Expired windows are pruned at most once per window length, so the map only holds
 * recently active addresses. Attempts with an unknown address share one bucket.
 */
@Slf4j
public final class FixedWindowRateLimiter implements AdmissionControl {
    private static final String UNKNOWN = "unknown";

    private final int maxAttempts;
    private final long windowMillis;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    private volatile long lastPruneMillis;

    public FixedWindowRateLimiter(final int maxAttempts, final Duration window) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.maxAttempts = maxAttempts;
        this.windowMillis = window.toMillis();
        this.lastPruneMillis = System.currentTimeMillis();
    }

    @Override
    public boolean tryAdmit(final InetAddress address) {
        return tryAdmit(address, System.currentTimeMillis());
    }

    boolean tryAdmit(final InetAddress address, final long now) {
        pruneIfDue(now);

        final String client = address == null ? UNKNOWN : address.getHostAddress();
        final Window w = windows.compute(client, (k, current) ->
                current == null || now - current.startMillis >= windowMillis
                        ? new Window(now, 1)
                        : new Window(current.startMillis, current.count + 1));

        if (w.count > maxAttempts) {
            log.warn("Connection rate limit exceeded for {} ({} attempts in {} ms)", client, w.count, windowMillis);
            return false;
        }
        return true;
    }

    int trackedClients() {
        return windows.size();
    }

    private void pruneIfDue(final long now) {
        if (now - lastPruneMillis < windowMillis) return;
        lastPruneMillis = now;
        windows.values().removeIf(w -> now - w.startMillis >= windowMillis);
    }

    private record Window(long startMillis, int count) {
    }
}
