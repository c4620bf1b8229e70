package com.aimanager.rbac.util;

import io.quarkus.logging.Log;
import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the RBAC modules. Collaborator failures (audit sinks,
 * org chart lookups, evaluation errors) are reported through here and never rethrown.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log a failure with its stack trace at ERROR level.
     *
     * @param exception the failure, may be null
     * @param message   a {@link String#format} pattern
     * @param args      pattern arguments
     */
    public static void logError(Throwable exception, String message, Object... args) {
        log(Logger.Level.ERROR, exception, message, args);
    }

    /**
     * Log a failure with its stack trace at WARN level.
     */
    public static void logWarn(Throwable exception, String message, Object... args) {
        log(Logger.Level.WARN, exception, message, args);
    }

    /**
     * Log a failure at DEBUG level; a no-op when debug is disabled.
     */
    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        log(Logger.Level.DEBUG, exception, message, args);
    }

    /**
     * Record that a failure was deliberately absorbed by {@code where}.
     */
    public static void logIgnoredException(Throwable exception, String where) {
        if (exception != null && Log.isDebugEnabled()) {
            Log.debugf(exception, "Exception ignored in %s: %s", where, describe(exception));
        }
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * The exception message, or its class name when it has none.
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private static void log(Logger.Level level, Throwable exception, String message, Object... args) {
        String text = (args != null && args.length > 0) ? String.format(message, args) : message;
        if (exception == null) {
            Log.log(level, text);
            return;
        }
        Log.logf(level, "%s: %s%n%s", text, describe(exception), getStackTrace(exception));
    }
}
