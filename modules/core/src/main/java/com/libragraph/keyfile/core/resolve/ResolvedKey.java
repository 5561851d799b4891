package com.libragraph.keyfile.core.resolve;

import com.libragraph.keyfile.types.KeyFileFormat;
import com.libragraph.keyfile.util.SensitiveBytes;

import java.util.Objects;

/**
 * Key produced by {@link KeyResolver}, together with the encoding it came from.
 *
 * <p>Owns its bytes and zeroes them on {@link #close()}. Normally 32 bytes;
 * an XML key file may carry another length, which is passed through as-is.
 */
public final class ResolvedKey implements AutoCloseable {

    private final SensitiveBytes key;
    private final KeyFileFormat format;

    /**
     * Takes ownership of {@code key}.
     */
    public ResolvedKey(byte[] key, KeyFileFormat format) {
        this.key = SensitiveBytes.wrap(key);
        this.format = Objects.requireNonNull(format, "format cannot be null");
    }

    /**
     * Returns a copy of the key; the caller must zero it.
     */
    public byte[] bytes() {
        return key.copy();
    }

    public int length() {
        return key.length();
    }

    public KeyFileFormat format() {
        return format;
    }

    @Override
    public void close() {
        key.close();
    }

    @Override
    public String toString() {
        return "ResolvedKey[" + format.label() + ", " + key.length() + " bytes]";
    }
}
