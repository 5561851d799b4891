package com.libragraph.keyfile.core;

/**
 * Base class for key file failures that callers must handle.
 * Soft parser misses never surface as this exception.
 */
public class KeyFileException extends RuntimeException {

    public KeyFileException(String message, Throwable cause) {
        super(message, cause);
    }

    public KeyFileException(String message) {
        super(message);
    }
}
