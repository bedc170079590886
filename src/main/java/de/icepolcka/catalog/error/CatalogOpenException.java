package de.icepolcka.catalog.error;

/**
 * The store backing a catalog could not be created or opened.
 */
public class CatalogOpenException extends CatalogException {

    public CatalogOpenException(String message) {
        super(message);
    }

    public CatalogOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
