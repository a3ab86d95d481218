package com.nana.results.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.lang.Thread.UncaughtExceptionHandler;

/**
 * GlobalExceptionHandler - Last-Resort Handler for Uncaught Exceptions
 *
 * <p>Logs the full stack trace through SLF4J and as an {@code [ERROR_EVENT]},
 * then prints a short message to the console pointing at the log file.
 */
public final class GlobalExceptionHandler implements UncaughtExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final PrintStream console;

    public GlobalExceptionHandler() {
        this(System.err);
    }

    GlobalExceptionHandler(PrintStream console) {
        this.console = console;
    }

    /** Installs the handler as the JVM default and on the calling thread. */
    public static void install() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler();
        Thread.setDefaultUncaughtExceptionHandler(handler);
        Thread.currentThread().setUncaughtExceptionHandler(handler);
        log.info("GlobalExceptionHandler installed on all threads.");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        log.error("UNCAUGHT EXCEPTION on thread '{}': {}", thread.getName(), throwable.getMessage(), throwable);
        AppLogger.logErrorEvent("UNCAUGHT_EXCEPTION",
                "thread=" + thread.getName() + ", exception=" + throwable.getClass().getSimpleName(),
                throwable);
        console.println(buildUserMessage(throwable));
        console.println("Full log file: " + AppLogger.getLogFilePath());
    }

    String buildUserMessage(Throwable throwable) {
        if (throwable instanceof OutOfMemoryError) {
            return "Error: the analysis ran out of memory. Try a smaller mark sheet or a larger heap.";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        return "Error: an unexpected problem occurred: " + message;
    }
}
