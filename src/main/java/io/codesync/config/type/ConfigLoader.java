package io.codesync.config.type;

import io.codesync.config.impl.SyncConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads settings from the YAML file at {@code path}, or only defaults and overrides
     * when {@code path} is {@code null}.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static SyncConfig load(final String path) throws IOException {
        return path == null ? SyncConfig.defaults() : SyncConfig.load(path);
    }
}
