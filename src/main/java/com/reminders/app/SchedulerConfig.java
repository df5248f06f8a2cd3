package com.reminders.app;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for the reminder service.
 *
 * <p>Values come from {@code reminders.properties} on the classpath. Any key
 * can be overridden with a JVM system property of the same name, e.g.
 * {@code -Dmetrics.port=9090}. Keys missing from both fall back to the
 * defaults below.</p>
 */
public class SchedulerConfig {
    private static final Logger logger = Logger.getLogger(SchedulerConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "/reminders.properties";

    static final String DB_URL = "db.url";
    static final String DB_USER = "db.user";
    static final String DB_PASSWORD = "db.password";
    static final String DB_POOL_SIZE = "db.pool-size";
    static final String DISPATCH_WORKERS = "dispatch.workers";
    static final String SHUTDOWN_TIMEOUT_SECONDS = "shutdown.timeout-seconds";
    static final String METRICS_PORT = "metrics.port";
    static final String RECIPES_PATH = "recipes.path";

    private final Properties properties;

    private SchedulerConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the default resource, with system property overrides.
     */
    public static SchedulerConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load a classpath resource, with system property overrides.
     *
     * @param resource classpath resource name; a missing resource means all defaults
     * @throws IllegalStateException if the resource exists but cannot be read
     */
    public static SchedulerConfig load(String resource) {
        Properties properties = defaults();

        try (InputStream in = SchedulerConfig.class.getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded configuration from " + resource);
            } else {
                logger.warning("Configuration " + resource + " not found, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration " + resource, e);
        }

        for (String key : properties.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return new SchedulerConfig(properties);
    }

    /**
     * Build a config from explicit values on top of the defaults. No overrides apply.
     */
    public static SchedulerConfig of(Properties values) {
        Properties properties = defaults();
        properties.putAll(values);
        return new SchedulerConfig(properties);
    }

    private static Properties defaults() {
        Properties defaults = new Properties();
        defaults.setProperty(DB_URL, "jdbc:h2:./reminders");
        defaults.setProperty(DB_USER, "sa");
        defaults.setProperty(DB_PASSWORD, "");
        defaults.setProperty(DB_POOL_SIZE, "10");
        defaults.setProperty(DISPATCH_WORKERS, "4");
        defaults.setProperty(SHUTDOWN_TIMEOUT_SECONDS, "30");
        defaults.setProperty(METRICS_PORT, "8080");
        defaults.setProperty(RECIPES_PATH, "recipes.json");
        return defaults;
    }

    public String getDbUrl() {
        return properties.getProperty(DB_URL);
    }

    public String getDbUser() {
        return properties.getProperty(DB_USER);
    }

    public String getDbPassword() {
        return properties.getProperty(DB_PASSWORD);
    }

    public int getDbPoolSize() {
        return getInt(DB_POOL_SIZE);
    }

    public int getDispatchWorkers() {
        return getInt(DISPATCH_WORKERS);
    }

    public long getShutdownTimeoutSeconds() {
        return getInt(SHUTDOWN_TIMEOUT_SECONDS);
    }

    public int getMetricsPort() {
        return getInt(METRICS_PORT);
    }

    public String getRecipesPath() {
        return properties.getProperty(RECIPES_PATH);
    }

    private int getInt(String key) {
        String value = properties.getProperty(key).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " must be a number, got '" + value + "'", e);
        }
    }
}
