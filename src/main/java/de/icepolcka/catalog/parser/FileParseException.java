package de.icepolcka.catalog.parser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File content could not be interpreted (truncated, wrong format, missing fields).
 */
public class FileParseException extends IOException {

    private final Path path;

    public FileParseException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public FileParseException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
