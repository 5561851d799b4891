package com.libragraph.keyfile.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * Transport for key file contents. Errors are surfaced to callers unchanged.
 */
public interface KeyFileStorage {

    /**
     * Reads the complete file. The caller owns (and should zero) the returned array.
     *
     * @throws KeyFileNotFoundException if the file does not exist
     * @throws StorageException on I/O errors
     */
    Uni<byte[]> read(KeySource source);

    /**
     * Writes {@code data} to {@code target}, replacing any existing file.
     * Readers never observe a partially written file.
     *
     * @throws StorageException on I/O errors
     */
    Uni<Void> write(KeySource target, byte[] data);

    /**
     * Checks whether a key file exists.
     */
    Uni<Boolean> exists(KeySource source);
}
