package de.icepolcka.catalog.error;

/**
 * A sync pass stopped because cancellation was requested or its deadline passed.
 */
public class SyncCancelledException extends SyncException {

    public SyncCancelledException(String message) {
        super(message);
    }
}
