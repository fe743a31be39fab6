package com.cyclomatic.util;

import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FileUtils {

    private FileUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates the directory a file will be written to, if it doesn't exist yet.
     *
     * @param filePath The file about to be written
     * @param logger The logger instance for error reporting
     * @throws IOException If directory creation fails
     */
    public static void createParentDirectories(final Path filePath, final Logger logger) throws IOException {
        final Path parent = filePath.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            logger.info("Created directory: {}", parent);
        } catch (final IOException e) {
            logger.error("Failed to create directory: {}", parent, e);
            throw e;
        }
    }
}
