package de.icepolcka.catalog.error;

/**
 * No dataset matched a query that must return one.
 */
public class DatasetNotFoundException extends CatalogException {

    public DatasetNotFoundException(String message) {
        super(message);
    }
}
