package com.libragraph.keyfile.util;

/**
 * Little-endian integer reads over raw byte arrays.
 */
public final class LittleEndian {

    private LittleEndian() {}

    /**
     * Reads an unsigned 32-bit value at {@code offset}, returned in the low
     * 32 bits of a long.
     *
     * @throws IndexOutOfBoundsException if fewer than 4 bytes are available
     */
    public static long readUInt32(byte[] data, int offset) {
        if (offset < 0 || data.length - offset < 4) {
            throw new IndexOutOfBoundsException(
                    "Need 4 bytes at offset " + offset + ", length is " + data.length);
        }
        return (data[offset] & 0xFFL)
                | (data[offset + 1] & 0xFFL) << 8
                | (data[offset + 2] & 0xFFL) << 16
                | (data[offset + 3] & 0xFFL) << 24;
    }
}
