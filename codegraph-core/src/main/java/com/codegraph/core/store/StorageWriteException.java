package com.codegraph.core.store;

/**
 * Thrown when a write batch cannot be applied or persisted. The store is left unchanged.
 */
public class StorageWriteException extends RuntimeException {

    public StorageWriteException(String message) {
        super(message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
