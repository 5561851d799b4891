package com.libragraph.keyfile.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.security.MessageDigest;

/**
 * SHA-256 over key material.
 *
 * Multi-part input is fed to the digest part by part, so callers never need
 * a concatenated copy of sensitive buffers.
 */
public final class KeyDigest {

    /** SHA-256 output length. */
    public static final int LENGTH = 32;

    private KeyDigest() {}

    public static byte[] sha256(byte[] data) {
        return DigestUtils.sha256(data);
    }

    /**
     * Digest of {@code parts[0] || parts[1] || ...}.
     */
    public static byte[] sha256(byte[]... parts) {
        MessageDigest digest = DigestUtils.getSha256Digest();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return digest.digest();
    }
}
