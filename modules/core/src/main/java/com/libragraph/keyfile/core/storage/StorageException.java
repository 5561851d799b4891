package com.libragraph.keyfile.core.storage;

/**
 * Wraps checked I/O exceptions from key file transport.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
