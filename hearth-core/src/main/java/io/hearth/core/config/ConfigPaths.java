package io.hearth.core.config;

import io.hearth.core.config.model.HearthConfig;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String DB_PATH_ENV = "HEARTH_DB_PATH";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".hearth", "config.json");
    }

    /**
     * {@value #DB_PATH_ENV} wins over the configured path so deployments can relocate the database without
     * editing the config file.
     */
    public static Path resolveDatabasePath(HearthConfig config, Map<String, String> env) {
        String override = env == null ? null : env.get(DB_PATH_ENV);
        if (override != null && !override.isBlank()) {
            return expandHome(override);
        }
        String configured = config == null || config.storage() == null ? null : config.storage().databasePath();
        return expandHome(configured);
    }

    public static Path expandHome(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".hearth", "hearth.db");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
