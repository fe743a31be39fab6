package com.cyclomatic.util;

/**
 * Uniform error messages for failures surfaced to the user.
 */
public final class ExceptionUtils {

    private ExceptionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a standardized error message for exceptions.
     *
     * @param operation The operation that failed
     * @param context Additional context, may be null
     * @param exception The exception that occurred
     * @return A formatted error message
     */
    public static String createErrorMessage(final String operation, final String context, final Exception exception) {
        final StringBuilder message = new StringBuilder(operation).append(" failed");
        if (context != null && !context.isEmpty()) {
            message.append(" for ").append(context);
        }
        message.append(": ").append(exception.getMessage());
        return message.toString();
    }
}
