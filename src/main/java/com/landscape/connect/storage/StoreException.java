package com.landscape.connect.storage;

/**
 * Failure reading from or writing to the entity store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
