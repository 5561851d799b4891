package com.libragraph.keyfile.core.create;

/**
 * Source of cryptographically secure random bytes.
 */
public interface RandomSource {

    /**
     * Returns {@code count} fresh random bytes. The caller owns the array.
     *
     * @throws RandomSourceException if the source cannot produce bytes
     */
    byte[] nextBytes(int count);
}
