package de.icepolcka.catalog.error;

/**
 * Unexpected failure of the underlying store (I/O, SQL).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
