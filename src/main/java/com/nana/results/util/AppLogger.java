package com.nana.results.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * AppLogger - Logging Utility
 *
 * <p>Per-class logging stays with
 * {@code LoggerFactory.getLogger(MyClass.class)}. This class adds what
 * does not belong to any one class:
 * <ul>
 *   <li>startup and shutdown banners for the CLI session,</li>
 *   <li>{@code [EVENT]} / {@code [WARN_EVENT]} / {@code [ERROR_EVENT]}
 *       lines for analysis, import and export milestones,</li>
 *   <li>MDC operation context ({@code operation=RESULT_ANALYSIS},
 *       {@code CSV_IMPORT}, ...), printed by the logback pattern.</li>
 * </ul>
 *
 * <p>MDC is thread-local: always clear the operation in a {@code finally}
 * block.
 */
public final class AppLogger {

    private static final Logger APP_LOG = LoggerFactory.getLogger("com.nana.results.APP");

    private static final DateTimeFormatter EVENT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    public static final String OP_RESULT_ANALYSIS = "RESULT_ANALYSIS";
    public static final String OP_BRANCH_COMPARISON = "BRANCH_COMPARISON";
    public static final String OP_CSV_IMPORT = "CSV_IMPORT";
    public static final String OP_XLSX_IMPORT = "XLSX_IMPORT";
    public static final String OP_CSV_EXPORT = "CSV_EXPORT";
    public static final String OP_XLSX_EXPORT = "XLSX_EXPORT";

    private static final String APP_VERSION = "1.0.0-SNAPSHOT";

    private static final String APP_NAME = "Student Result Analytics";

    private AppLogger() {
        throw new UnsupportedOperationException("AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STARTUP / SHUTDOWN BANNERS
    // -----------------------------------------------------------------------

    public static void logStartup() {
        String separator = "=".repeat(60);
        APP_LOG.info(separator);
        APP_LOG.info("  {} v{}", APP_NAME, APP_VERSION);
        APP_LOG.info("  Starting up - {}", LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Java:    {} ({})",
                System.getProperty("java.version"),
                System.getProperty("java.vendor"));
        APP_LOG.info("  OS:      {} {} ({})",
                System.getProperty("os.name"),
                System.getProperty("os.version"),
                System.getProperty("os.arch"));
        APP_LOG.info(separator);
    }

    /**
     * @param startTime when the session started; null logs a zero duration
     */
    public static void logShutdown(LocalDateTime startTime) {
        String separator = "-".repeat(60);
        long millis = startTime == null ? 0 : Duration.between(startTime, LocalDateTime.now()).toMillis();
        APP_LOG.info(separator);
        APP_LOG.info("  {} shutting down - {}", APP_NAME, LocalDateTime.now().format(EVENT_FORMAT));
        APP_LOG.info("  Session duration: {} ms", millis);
        APP_LOG.info(separator);
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName short label (e.g., "ANALYSIS_COMPLETED")
     * @param details   context (e.g., "dataset=cse.csv, students=60")
     */
    public static void logEvent(String eventName, String details) {
        APP_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    public static void logWarningEvent(String eventName, String details) {
        APP_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    public static void logErrorEvent(String eventName, String details, Throwable throwable) {
        APP_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
    }

    // -----------------------------------------------------------------------
    // LOG FILE PATH
    // -----------------------------------------------------------------------

    /**
     * Mirrors the file appender location in {@code logback.xml}.
     *
     * @return path of the active log file
     */
    public static Path getLogFilePath() {
        return Paths.get(System.getProperty("user.home"), ".result_analytics", "logs", "result-analytics.log");
    }
}
