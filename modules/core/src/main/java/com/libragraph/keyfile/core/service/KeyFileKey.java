package com.libragraph.keyfile.core.service;

import com.libragraph.keyfile.core.storage.KeySource;
import com.libragraph.keyfile.types.KeyFileFormat;
import com.libragraph.keyfile.util.SensitiveBytes;

import javax.security.auth.Destroyable;
import java.util.Objects;

/**
 * A key file loaded as one factor of a composite key.
 *
 * <p>Holds the source location (display only), the format the key was
 * resolved from, and the key bytes. {@link #destroy()} zeroes the key.
 */
public final class KeyFileKey implements Destroyable {

    private final KeySource source;
    private final KeyFileFormat format;
    private final SensitiveBytes keyData;

    /**
     * Takes ownership of {@code keyData}.
     */
    public KeyFileKey(KeySource source, KeyFileFormat format, byte[] keyData) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.format = Objects.requireNonNull(format, "format cannot be null");
        this.keyData = SensitiveBytes.wrap(keyData);
    }

    public KeySource source() {
        return source;
    }

    public KeyFileFormat format() {
        return format;
    }

    /**
     * Returns a copy of the key bytes; the caller must zero it.
     *
     * @throws IllegalStateException if destroyed
     */
    public byte[] keyData() {
        return keyData.copy();
    }

    public int length() {
        return keyData.length();
    }

    @Override
    public void destroy() {
        keyData.close();
    }

    @Override
    public boolean isDestroyed() {
        return keyData.isClosed();
    }

    @Override
    public String toString() {
        return "KeyFileKey[" + source.displayName() + ", " + format.label() + "]";
    }
}
