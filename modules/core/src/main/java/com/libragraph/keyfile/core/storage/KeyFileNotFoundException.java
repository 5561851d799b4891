package com.libragraph.keyfile.core.storage;

/**
 * Thrown when a read targets a key file that does not exist.
 */
public class KeyFileNotFoundException extends StorageException {

    private final KeySource source;

    public KeyFileNotFoundException(KeySource source) {
        super("Key file not found: " + source);
        this.source = source;
    }

    public KeySource source() {
        return source;
    }
}
