package de.icepolcka.catalog.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One logical observation, possibly backed by several files, each attached under a role.
 * {@code id} is assigned by the store; {@link #UNSAVED} marks a record not yet inserted.
 */
public record DatasetRecord(
        long id,
        IdentityKey identityKey,
        Map<String, String> roles,
        DatasetAttributes attributes
) {
    public static final long UNSAVED = -1L;

    public DatasetRecord {
        if (identityKey == null) {
            throw new IllegalArgumentException("identityKey cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        roles = roles != null ? Map.copyOf(roles) : Map.of();
    }

    public static DatasetRecord create(IdentityKey identityKey, String role, String path,
                                       DatasetAttributes attributes) {
        return new DatasetRecord(UNSAVED, identityKey, Map.of(role, path), attributes);
    }

    public Optional<String> pathFor(String role) {
        return Optional.ofNullable(roles.get(role));
    }

    public DatasetRecord withId(long newId) {
        return new DatasetRecord(newId, identityKey, roles, attributes);
    }

    public DatasetRecord withRole(String role, String path) {
        Map<String, String> updated = new TreeMap<>(roles);
        updated.put(role, path);
        return new DatasetRecord(id, identityKey, updated, attributes);
    }

    public DatasetRecord withoutPath(String path) {
        Map<String, String> updated = new TreeMap<>(roles);
        updated.values().removeIf(path::equals);
        return new DatasetRecord(id, identityKey, updated, attributes);
    }

    public DatasetRecord withAttributes(DatasetAttributes fresh) {
        return new DatasetRecord(id, identityKey, roles, attributes.mergedWith(fresh));
    }

    public Instant time() {
        return attributes.time();
    }
}
