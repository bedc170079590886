package de.icepolcka.catalog.error;

import de.icepolcka.catalog.domain.SyncSummary;

/**
 * A sync pass was aborted. Nothing from the aborted pass was committed.
 * The summary reports progress up to the fault point.
 */
public class SyncException extends CatalogException {

    private SyncSummary summary = SyncSummary.EMPTY;

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public SyncSummary summary() {
        return summary;
    }

    /**
     * Attach the progress reached before the abort. Set once by the catalog that ran the pass.
     */
    public SyncException withSummary(SyncSummary summary) {
        this.summary = summary;
        return this;
    }

    /**
     * File that was being processed when the pass aborted, or null if the fault was not file specific.
     */
    public String failedPath() {
        return summary.failedPath();
    }
}
