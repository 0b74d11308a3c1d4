package com.exportscan.repository;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pre-read checks for batch files on disk.
 */
public final class InputFileValidator {

    private InputFileValidator() {}

    /**
     * @throws IllegalArgumentException if the file is missing or unreadable
     */
    public static void validate(Path path) {
        if (path == null || !Files.exists(path)) {
            throw new IllegalArgumentException("File does not exist: " + path);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new IllegalArgumentException("File is not readable: " + path);
        }
    }
}
