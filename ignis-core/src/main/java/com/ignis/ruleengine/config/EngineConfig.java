package com.ignis.ruleengine.config;

import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Start-up settings, read from environment variables with system properties as fallback.
 *
 * <table>
 *   <tr><th>Environment</th><th>System property</th><th>Default</th></tr>
 *   <tr><td>IGNIS_RULES_FILE</td><td>rules.file</td><td>rules.json</td></tr>
 *   <tr><td>IGNIS_SERVER_PORT</td><td>server.port</td><td>8080</td></tr>
 *   <tr><td>IGNIS_RELOAD_INTERVAL_SECONDS</td><td>rules.reload.interval.seconds</td><td>10</td></tr>
 *   <tr><td>IGNIS_BATCH_PARALLELISM</td><td>batch.parallelism</td><td>available processors</td></tr>
 * </table>
 */
public record EngineConfig(
        Path rulesFile,
        int serverPort,
        long reloadIntervalSeconds,
        int batchParallelism
) {
    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public EngineConfig {
        if (rulesFile == null) {
            throw new IllegalArgumentException("Rules file cannot be null");
        }
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("Invalid server port: " + serverPort);
        }
        if (reloadIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Reload interval must be positive: " + reloadIntervalSeconds);
        }
        if (batchParallelism <= 0) {
            throw new IllegalArgumentException("Batch parallelism must be positive: " + batchParallelism);
        }
    }

    public static EngineConfig fromEnvironment() {
        return new EngineConfig(
                Path.of(get("IGNIS_RULES_FILE", "rules.file", "rules.json")),
                parseInt("IGNIS_SERVER_PORT", "server.port", 8080),
                parseInt("IGNIS_RELOAD_INTERVAL_SECONDS", "rules.reload.interval.seconds", 10),
                parseInt("IGNIS_BATCH_PARALLELISM", "batch.parallelism",
                        Runtime.getRuntime().availableProcessors())
        );
    }

    /**
     * Gets a value from an environment variable, falling back to the system property of the same name.
     */
    public static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }

    private static String get(String envKey, String propertyKey, String defaultValue) {
        String value = System.getenv(envKey);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(propertyKey, defaultValue);
        }
        return value;
    }

    private static int parseInt(String envKey, String propertyKey, int defaultValue) {
        String raw = get(envKey, propertyKey, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid value '" + raw + "' for " + envKey + ", using " + defaultValue);
            return defaultValue;
        }
    }
}
