package de.icepolcka.catalog.error;

import de.icepolcka.catalog.domain.IdentityKey;

/**
 * More than one dataset exists for an identity key. This is a consistency fault:
 * the catalog refuses to guess which record is authoritative.
 */
public class DuplicateDatasetException extends SyncException {

    private final IdentityKey identityKey;
    private final int matches;

    public DuplicateDatasetException(IdentityKey identityKey, int matches) {
        super("Found " + matches + " datasets for identity " + identityKey + ", expected at most one");
        this.identityKey = identityKey;
        this.matches = matches;
    }

    public IdentityKey identityKey() {
        return identityKey;
    }

    public int matches() {
        return matches;
    }
}
