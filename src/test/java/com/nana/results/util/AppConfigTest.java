package com.nana.results.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    @DisplayName("built-in defaults apply when nothing is overridden")
    void defaults() {
        AppConfig config = AppConfig.fromProperties(null);

        assertEquals(32, config.getCacheCapacity());
        assertEquals(5, config.getReportTopSize());
        assertEquals("TOTAL_MARKS", config.getDefaultMetric());
        assertNull(config.getPropertiesFilePath());
    }

    @Test
    @DisplayName("overrides win over defaults")
    void overrides(@TempDir Path exportDir) {
        Properties props = new Properties();
        props.setProperty(AppConfig.KEY_CACHE_CAPACITY, "4");
        props.setProperty(AppConfig.KEY_REPORT_TOP_SIZE, " 10 ");
        props.setProperty(AppConfig.KEY_DEFAULT_METRIC, "SGPA");
        props.setProperty(AppConfig.KEY_DEFAULT_EXPORT_DIR, exportDir.toString());

        AppConfig config = AppConfig.fromProperties(props);

        assertEquals(4, config.getCacheCapacity());
        assertEquals(10, config.getReportTopSize());
        assertEquals("SGPA", config.getDefaultMetric());
        assertEquals(exportDir, config.getDefaultExportDir());
    }

    @Test
    @DisplayName("bad numbers fall back, and sizes never drop below one")
    void invalidValues() {
        Properties props = new Properties();
        props.setProperty(AppConfig.KEY_CACHE_CAPACITY, "lots");
        props.setProperty(AppConfig.KEY_REPORT_TOP_SIZE, "0");

        AppConfig config = AppConfig.fromProperties(props);

        assertEquals(32, config.getCacheCapacity());
        assertEquals(1, config.getReportTopSize());
    }

    @Test
    @DisplayName("a missing export directory falls back to the home directory")
    void missingExportDir(@TempDir Path tempDir) {
        Properties props = new Properties();
        props.setProperty(AppConfig.KEY_DEFAULT_EXPORT_DIR, tempDir.resolve("absent").toString());

        AppConfig config = AppConfig.fromProperties(props);

        assertEquals(Paths.get(System.getProperty("user.home")), config.getDefaultExportDir());
    }

    @Test
    @DisplayName("an absent key returns the caller's default")
    void missingKey() {
        AppConfig config = AppConfig.fromProperties(new Properties());

        assertEquals(7, config.getInt("no.such.key", 7));
        assertEquals(32, config.getInt(AppConfig.KEY_CACHE_CAPACITY, 7));
    }
}
