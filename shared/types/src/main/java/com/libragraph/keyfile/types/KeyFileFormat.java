package com.libragraph.keyfile.types;

/**
 * On-disk encodings a key file can be resolved from.
 * {@link #HASHED} is the fallback when no structured encoding matches.
 */
public enum KeyFileFormat {
    XML("xml"),
    BINARY_32("binary"),
    HEX_64("hex"),
    HASHED("hashed");

    private final String label;

    KeyFileFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
