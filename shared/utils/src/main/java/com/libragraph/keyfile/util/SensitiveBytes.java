package com.libragraph.keyfile.util;

import java.util.Arrays;
import java.util.Objects;

/**
 * Owns a byte array holding key material or entropy and zeroes it on close.
 *
 * <p>Use with try-with-resources so the array is overwritten on every exit
 * path:
 * <pre>
 *     try (SensitiveBytes key = SensitiveBytes.wrap(candidate)) {
 *         ...
 *     }
 * </pre>
 *
 * <p>{@link #wrap(byte[])} takes ownership of the caller's array (no copy).
 * {@link #copyOf(byte[])} leaves the source untouched.
 */
public final class SensitiveBytes implements AutoCloseable {

    private final byte[] data;
    private boolean closed;

    private SensitiveBytes(byte[] data) {
        this.data = data;
    }

    /**
     * Takes ownership of {@code data}; it is zeroed when this wrapper closes.
     */
    public static SensitiveBytes wrap(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new SensitiveBytes(data);
    }

    /**
     * Copies {@code data} into a new owned array.
     */
    public static SensitiveBytes copyOf(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new SensitiveBytes(Arrays.copyOf(data, data.length));
    }

    /**
     * Returns the owned array itself, not a copy.
     *
     * @throws IllegalStateException if already closed
     */
    public byte[] bytes() {
        if (closed) {
            throw new IllegalStateException("SensitiveBytes already closed");
        }
        return data;
    }

    /**
     * Returns a fresh copy the caller becomes responsible for.
     */
    public byte[] copy() {
        byte[] owned = bytes();
        return Arrays.copyOf(owned, owned.length);
    }

    public int length() {
        return data.length;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            zero(data);
            closed = true;
        }
    }

    /**
     * Overwrites {@code data} with zeros. Null-safe.
     */
    public static void zero(byte[] data) {
        if (data != null) {
            Arrays.fill(data, (byte) 0);
        }
    }

    @Override
    public String toString() {
        // Never print contents
        return "SensitiveBytes[" + data.length + " bytes" + (closed ? ", closed]" : "]");
    }
}
