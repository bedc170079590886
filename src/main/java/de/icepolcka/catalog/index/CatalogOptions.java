package de.icepolcka.catalog.index;

/**
 * Open-time behaviour of a catalog.
 *
 * @param sync    run a full sync before {@code open} returns
 * @param recheck on sync, re-parse known files whose modification time is newer than their watermark
 */
public record CatalogOptions(boolean sync, boolean recheck) {

    public static final CatalogOptions DEFAULT = new CatalogOptions(true, false);

    public static CatalogOptions readOnly() {
        return new CatalogOptions(false, false);
    }
}
