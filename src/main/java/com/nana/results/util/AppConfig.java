package com.nana.results.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * AppConfig - Application Configuration Manager
 *
 * <p>Three layers, later ones winning: built-in defaults, the classpath
 * resource {@code result-analytics.properties}, and an optional user file
 * at {@code ~/.result_analytics/result-analytics.properties}.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String KEY_CACHE_CAPACITY      = "engine.cache.capacity";
    public static final String KEY_REPORT_TOP_SIZE     = "report.top.size";
    public static final String KEY_DEFAULT_METRIC      = "ranking.default.metric";
    public static final String KEY_DEFAULT_EXPORT_DIR  = "export.default.directory";

    static final String RESOURCE_NAME = "result-analytics.properties";

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_CACHE_CAPACITY,     "32");
        DEFAULTS.setProperty(KEY_REPORT_TOP_SIZE,    "5");
        DEFAULTS.setProperty(KEY_DEFAULT_METRIC,     "TOTAL_MARKS");
        DEFAULTS.setProperty(KEY_DEFAULT_EXPORT_DIR, System.getProperty("user.home"));
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig(defaultUserFile());
        }
        return instance;
    }

    /**
     * Builds a configuration from explicit overrides on top of the
     * built-in defaults only. Used by tests and embedding callers.
     *
     * @param overrides properties to apply; may be null
     * @return a configuration independent of the singleton
     */
    public static AppConfig fromProperties(Properties overrides) {
        return new AppConfig(overrides);
    }

    private final Properties props;
    private final Path propertiesFilePath;

    private AppConfig(Path userFile) {
        propertiesFilePath = userFile;
        props = new Properties(DEFAULTS);
        loadClasspathProperties();
        loadUserProperties();
        log.info("AppConfig loaded. User properties file: {}", propertiesFilePath.toAbsolutePath());
    }

    private AppConfig(Properties overrides) {
        propertiesFilePath = null;
        props = new Properties(DEFAULTS);
        if (overrides != null) {
            overrides.stringPropertyNames()
                     .forEach(key -> props.setProperty(key, overrides.getProperty(key)));
        }
    }

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            log.warn("Config key '{}' is not an integer; using {}.", key, defaultValue);
            return defaultValue;
        }
    }

    public int getCacheCapacity() {
        return Math.max(1, getInt(KEY_CACHE_CAPACITY, 32));
    }

    public int getReportTopSize() {
        return Math.max(1, getInt(KEY_REPORT_TOP_SIZE, 5));
    }

    /** @return configured default rank metric name (e.g., "TOTAL_MARKS") */
    public String getDefaultMetric() {
        return getString(KEY_DEFAULT_METRIC);
    }

    public Path getDefaultExportDir() {
        String dirStr = getString(KEY_DEFAULT_EXPORT_DIR);
        Path dir = Paths.get(dirStr);
        if (!Files.isDirectory(dir)) {
            return Paths.get(System.getProperty("user.home"));
        }
        return dir;
    }

    /** @return the user properties file, or null for a detached configuration */
    public Path getPropertiesFilePath() {
        return propertiesFilePath;
    }

    private void loadClasspathProperties() {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.debug("No {} on the classpath; using defaults.", RESOURCE_NAME);
                return;
            }
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load classpath properties: {}", ex.getMessage());
        }
    }

    private void loadUserProperties() {
        if (!Files.exists(propertiesFilePath)) {
            log.debug("User properties file not found; using defaults.");
            return;
        }
        try (InputStream in = Files.newInputStream(propertiesFilePath)) {
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load user properties: {}", ex.getMessage());
        }
    }

    private static Path defaultUserFile() {
        return Paths.get(System.getProperty("user.home"), ".result_analytics", RESOURCE_NAME);
    }
}
