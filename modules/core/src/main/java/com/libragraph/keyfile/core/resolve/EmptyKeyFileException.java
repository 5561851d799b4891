package com.libragraph.keyfile.core.resolve;

import com.libragraph.keyfile.core.KeyFileException;

/**
 * Thrown when a key file has no content to derive a key from.
 */
public class EmptyKeyFileException extends KeyFileException {

    public EmptyKeyFileException() {
        super("Key file is empty");
    }
}
