package de.icepolcka.catalog.domain;

/**
 * What a parser extracted from one file: the dataset it belongs to, the role it fills there,
 * and the descriptive attributes found in it.
 */
public record ParsedFile(
        IdentityKey identityKey,
        String role,
        DatasetAttributes attributes
) {
    public ParsedFile {
        if (identityKey == null) {
            throw new IllegalArgumentException("identityKey cannot be null");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be blank");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
    }

    /**
     * Convenience for products where each file kind fills the role of the same name.
     */
    public static ParsedFile forKind(FileKind kind, IdentityKey identityKey, DatasetAttributes attributes) {
        return new ParsedFile(identityKey, kind.name(), attributes);
    }
}
