package de.icepolcka.catalog.domain;

import java.time.Instant;

/**
 * Store entry for a file the catalog has accepted.
 * {@code lastChecked} is the watermark compared against the on-disk modification time on recheck.
 */
public record FileRecord(
        String path,
        FileKind kind,
        Instant modifiedAt,
        Instant lastChecked
) {
    public FileRecord {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (lastChecked == null) {
            throw new IllegalArgumentException("lastChecked cannot be null");
        }
    }

    public boolean isCorrupt() {
        return kind.isCorrupt();
    }

    /**
     * True if the file changed on disk after this record was last checked.
     */
    public boolean isStale(Instant onDiskModifiedAt) {
        return onDiskModifiedAt.isAfter(lastChecked);
    }
}
