package com.libragraph.keyfile.core.create;

import jakarta.enterprise.context.ApplicationScoped;

import java.security.SecureRandom;

/**
 * {@link RandomSource} backed by the platform's default {@link SecureRandom}.
 */
@ApplicationScoped
public class SecureRandomSource implements RandomSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public byte[] nextBytes(int count) {
        byte[] bytes = new byte[count];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            throw new RandomSourceException("Secure random generator failed", e);
        }
        return bytes;
    }
}
