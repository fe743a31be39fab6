package com.cyclomatic.util;

import org.slf4j.Logger;

/**
 * Logging shortcuts shared by the analysis classes.
 */
public final class LoggingUtils {

    private LoggingUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Logs a debug message only if debug logging is enabled.
     * Keeps varargs arrays from being built on hot traversal paths.
     *
     * @param logger The logger instance
     * @param message The debug message to log
     * @param args Optional arguments for message formatting
     */
    public static void debugIfEnabled(final Logger logger, final String message, final Object... args) {
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    /**
     * Logs a debug message with a single argument only if debug logging is enabled.
     *
     * @param logger The logger instance
     * @param message The debug message to log
     * @param arg The argument for message formatting
     */
    public static void debugIfEnabled(final Logger logger, final String message, final Object arg) {
        if (logger.isDebugEnabled()) {
            logger.debug(message, arg);
        }
    }
}
