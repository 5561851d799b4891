package com.libragraph.keyfile.formats.signature;

import com.libragraph.keyfile.util.LittleEndian;

/**
 * Leading signatures of password database containers.
 * Each is a pair of little-endian 32-bit words at offsets 0 and 4.
 */
public enum ContainerSignature {
    CURRENT(0x9AA2D903L, 0xB54BFB67L, "current"),
    PRE_RELEASE(0x9AA2D903L, 0xB54BFB66L, "pre-release"),
    LEGACY(0x9AA2D903L, 0xB54BFB65L, "legacy");

    /** Bytes needed to compare a signature. */
    public static final int LENGTH = 8;

    private final long word1;
    private final long word2;
    private final String label;

    ContainerSignature(long word1, long word2, String label) {
        this.word1 = word1;
        this.word2 = word2;
        this.label = label;
    }

    public long word1() {
        return word1;
    }

    public long word2() {
        return word2;
    }

    public String label() {
        return label;
    }

    /**
     * Checks if {@code header} starts with this signature.
     * Headers shorter than {@link #LENGTH} never match.
     */
    public boolean matches(byte[] header) {
        if (header == null || header.length < LENGTH) {
            return false;
        }
        return LittleEndian.readUInt32(header, 0) == word1
                && LittleEndian.readUInt32(header, 4) == word2;
    }
}
