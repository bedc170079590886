package de.icepolcka.catalog.domain;

/**
 * Tag for an accepted file type of a product (e.g. "wrfout", "hdf5").
 * The {@link #CORRUPT} kind is reserved for files that could not be parsed.
 */
public record FileKind(String name) {

    public static final FileKind CORRUPT = new FileKind("corrupt");

    public FileKind {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("FileKind name cannot be blank");
        }
    }

    public boolean isCorrupt() {
        return CORRUPT.equals(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
