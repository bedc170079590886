package de.icepolcka.catalog.error;

/**
 * Base type for failures a catalog caller is expected to handle.
 */
public class CatalogException extends Exception {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
