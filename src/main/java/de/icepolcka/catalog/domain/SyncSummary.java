package de.icepolcka.catalog.domain;

/**
 * Outcome counters of one sync pass. Returned on success and attached to sync failures,
 * in which case {@code failedPath} names the file being processed when the pass aborted.
 */
public record SyncSummary(
        int scanned,
        int accepted,
        int refreshed,
        int skipped,
        int unrecognized,
        int corrupt,
        int fatal,
        String failedPath
) {
    public enum Outcome {
        ACCEPTED,
        REFRESHED,
        SKIPPED,
        UNRECOGNIZED,
        CORRUPT
    }

    public static final SyncSummary EMPTY = new SyncSummary(0, 0, 0, 0, 0, 0, 0, null);

    /**
     * Number of files parsed during the pass, successfully or not.
     */
    public int parsed() {
        return accepted + refreshed + corrupt;
    }

    public boolean aborted() {
        return fatal > 0;
    }

    /**
     * Mutable counter used while a pass runs.
     */
    public static final class Tally {
        private int scanned;
        private int accepted;
        private int refreshed;
        private int skipped;
        private int unrecognized;
        private int corrupt;

        public void scanned() {
            scanned++;
        }

        public void record(Outcome outcome) {
            switch (outcome) {
                case ACCEPTED -> accepted++;
                case REFRESHED -> refreshed++;
                case SKIPPED -> skipped++;
                case UNRECOGNIZED -> unrecognized++;
                case CORRUPT -> corrupt++;
            }
        }

        public SyncSummary completed() {
            return new SyncSummary(scanned, accepted, refreshed, skipped, unrecognized, corrupt, 0, null);
        }

        public SyncSummary abortedAt(String path) {
            return new SyncSummary(scanned, accepted, refreshed, skipped, unrecognized, corrupt, 1, path);
        }
    }
}
