package io.codesync;

import io.codesync.admission.FixedWindowRateLimiter;
import io.codesync.config.impl.SyncConfig;
import io.codesync.config.type.ConfigLoader;
import io.codesync.eviction.EvictionSweeper;
import io.codesync.metrics.SyncMetrics;
import io.codesync.persistence.PersistenceScheduler;
import io.codesync.registry.ReplicaRegistry;
import io.codesync.store.DocumentStore;
import io.codesync.store.FileDocumentStore;
import io.codesync.sync.ConnectionMultiplexer;
import io.codesync.sync.UpdatePipeline;
import io.codesync.transport.type.WebSocketTransport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main class to start the collaboration server.
 */
@Slf4j
public class Application {
    private static final int PERSIST_THREADS = 4;

    public static void main(final String[] args) throws Exception {
        if (args.length > 1) {
            System.err.println("Usage: java -jar codesync-collab.jar [collab.yaml]");
            System.exit(1);
        }

        final SyncConfig cfg = ConfigLoader.load(args.length == 1 ? args[0] : null);

        final Path dataDir = Paths.get(cfg.getDataPath()).toAbsolutePath();
        final DocumentStore store = new FileDocumentStore(dataDir);
        final SyncMetrics metrics = new SyncMetrics();

        final ReplicaRegistry registry = new ReplicaRegistry(store, metrics);
        final PersistenceScheduler persistence = new PersistenceScheduler(
                registry, store, metrics, cfg.persistDebounce(), PERSIST_THREADS);
        final EvictionSweeper sweeper = new EvictionSweeper(
                registry, persistence, metrics, cfg.inactivityTimeout(), cfg.sweepInterval());

        final UpdatePipeline pipeline = new UpdatePipeline(registry, persistence, metrics);
        final ConnectionMultiplexer multiplexer = new ConnectionMultiplexer(
                pipeline,
                new FixedWindowRateLimiter(cfg.getAdmissionMaxConnections(), cfg.admissionWindow()),
                metrics);

        final WebSocketTransport transport = new WebSocketTransport(cfg, multiplexer);
        try {
            transport.start();
        } catch (final Exception e) {
            log.error("Failed to bind {}:{}", cfg.getHost(), cfg.getPort(), e);
            persistence.close();
            System.exit(1);
            return;
        }

        sweeper.start();

        /* Stop intake first so nothing dirties a replica after the final flush. */
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down collaboration server...");
                transport.stop();
                sweeper.close();
                final int clean = persistence.flushAll(cfg.shutdownGrace());
                log.info("Flushed {} of {} resident document(s)", clean, registry.size());
                persistence.close();
                log.info("Shutdown complete. {}", metrics);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted during shutdown", e);
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }, "shutdown"));

        log.info("Collaboration server started on port {} (data in {})", transport.getPort(), dataDir);
    }
}
