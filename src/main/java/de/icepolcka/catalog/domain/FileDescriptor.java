package de.icepolcka.catalog.domain;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Describes a file discovered while walking a product root, before it is classified.
 * An entry the walk could not read carries no size or modification time.
 */
public record FileDescriptor(
        Path path,
        long sizeBytes,
        Instant modifiedAt,
        boolean readable
) {
    public FileDescriptor {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative");
        }
        if (readable && modifiedAt == null) {
            throw new IllegalArgumentException("modifiedAt cannot be null");
        }
    }

    public FileDescriptor(Path path, long sizeBytes, Instant modifiedAt) {
        this(path, sizeBytes, modifiedAt, true);
    }

    public static FileDescriptor unreadable(Path path) {
        return new FileDescriptor(path, 0, null, false);
    }

    public String fileName() {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }
}
