package io.codesync.config.impl;

import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Immutable server settings.
 * <p>
 * Every value is resolved in this order: system property {@code codesync.<key>},
 * environment variable {@code CODESYNC_<KEY>}, the YAML file, then the built-in default.
 */
@Getter
public final class SyncConfig {

    private String host;
    private int port;
    private String path;
    private String dataPath;
    private int admissionMaxConnections;
    private long admissionWindowMillis;
    private long persistDebounceMillis;
    private long inactivityTimeoutMillis;
    private long sweepIntervalMillis;
    private long shutdownGraceMillis;
    private long pingIntervalMillis;
    private int maxFrameBytes;
    private int syncThreads;

    private SyncConfig() {
    }

    /**
     * Built-in defaults plus environment and system-property overrides.
     */
    public static SyncConfig defaults() {
        return from(Map.of(), System::getenv, System.getProperties());
    }

    public static SyncConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            return from(m == null ? Map.of() : m, System::getenv, System.getProperties());
        }
    }

    /**
     * @param yaml       parsed YAML document, possibly empty
     * @param env        environment lookup, e.g. {@code System::getenv}
     * @param properties system properties
     * @throws IllegalArgumentException if any value is malformed or out of range
     */
    public static SyncConfig from(final Map<String, Object> yaml,
                                  final Function<String, String> env,
                                  final Properties properties) {
        final Source src = new Source(yaml, env, properties);
        final SyncConfig cfg = new SyncConfig();

        cfg.host                    = src.string("host", "0.0.0.0");
        cfg.port                    = src.integer("port", 4001);
        cfg.path                    = src.string("path", "/collab");
        cfg.dataPath                = src.string("dataPath", "./data/documents");
        cfg.admissionMaxConnections = src.integer("admissionMaxConnections", 50);
        cfg.admissionWindowMillis   = src.longValue("admissionWindowMillis", 60_000L);
        cfg.persistDebounceMillis   = src.longValue("persistDebounceMillis", 2_000L);
        cfg.inactivityTimeoutMillis = src.longValue("inactivityTimeoutMillis", 300_000L);
        cfg.sweepIntervalMillis     = src.longValue("sweepIntervalMillis", 60_000L);
        cfg.shutdownGraceMillis     = src.longValue("shutdownGraceMillis", 10_000L);
        cfg.pingIntervalMillis      = src.longValue("pingIntervalMillis", 30_000L);
        cfg.maxFrameBytes           = src.integer("maxFrameBytes", 1_000_000);
        cfg.syncThreads             = src.integer("syncThreads", 16);

        cfg.validate();
        return cfg;
    }

    public Duration admissionWindow() {
        return Duration.ofMillis(admissionWindowMillis);
    }

    public Duration persistDebounce() {
        return Duration.ofMillis(persistDebounceMillis);
    }

    public Duration inactivityTimeout() {
        return Duration.ofMillis(inactivityTimeoutMillis);
    }

    public Duration sweepInterval() {
        return Duration.ofMillis(sweepIntervalMillis);
    }

    public Duration shutdownGrace() {
        return Duration.ofMillis(shutdownGraceMillis);
    }

    private void validate() {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (!path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
        if (dataPath.isBlank()) throw new IllegalArgumentException("dataPath must not be blank");

        positive("admissionMaxConnections", admissionMaxConnections);
        positive("admissionWindowMillis", admissionWindowMillis);
        positive("persistDebounceMillis", persistDebounceMillis);
        positive("inactivityTimeoutMillis", inactivityTimeoutMillis);
        positive("sweepIntervalMillis", sweepIntervalMillis);
        positive("shutdownGraceMillis", shutdownGraceMillis);
        positive("pingIntervalMillis", pingIntervalMillis);
        positive("maxFrameBytes", maxFrameBytes);
        positive("syncThreads", syncThreads);
    }

    private static void positive(final String key, final long value) {
        if (value <= 0) throw new IllegalArgumentException(key + " must be positive: " + value);
    }

    /** {@code persistDebounceMillis} becomes {@code CODESYNC_PERSIST_DEBOUNCE_MILLIS}. */
    static String envName(final String key) {
        final StringBuilder sb = new StringBuilder("CODESYNC_");
        for (final char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) sb.append('_');
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    private record Source(Map<String, Object> yaml, Function<String, String> env, Properties properties) {

        private Object raw(final String key) {
            final String prop = properties.getProperty("codesync." + key);
            if (prop != null) return prop;

            final String fromEnv = env.apply(envName(key));
            if (fromEnv != null) return fromEnv;

            return yaml.get(key);
        }

        String string(final String key, final String def) {
            final Object v = raw(key);
            return v == null ? def : v.toString().trim();
        }

        int integer(final String key, final int def) {
            final long v = longValue(key, def);
            if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(key + " out of range: " + v);
            }
            return (int) v;
        }

        long longValue(final String key, final long def) {
            final Object v = raw(key);
            if (v == null) return def;
            if (v instanceof final Number n) return n.longValue();
            try {
                return Long.parseLong(v.toString().trim());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not a number: " + v, e);
            }
        }
    }
}
