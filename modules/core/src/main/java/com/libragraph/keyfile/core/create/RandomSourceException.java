package com.libragraph.keyfile.core.create;

import com.libragraph.keyfile.core.KeyFileException;

/**
 * Thrown when the secure random source cannot supply key bytes.
 */
public class RandomSourceException extends KeyFileException {

    public RandomSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public RandomSourceException(String message) {
        super(message);
    }
}
