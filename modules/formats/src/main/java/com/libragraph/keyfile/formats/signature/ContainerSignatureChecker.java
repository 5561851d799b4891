package com.libragraph.keyfile.formats.signature;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;

/**
 * Recognizes database container files by their first 8 bytes.
 * Used only to refuse a database that was picked as a key file by mistake.
 */
@ApplicationScoped
public class ContainerSignatureChecker {

    /**
     * Returns the container signature {@code data} starts with, if any.
     * Inputs shorter than 8 bytes are never containers.
     */
    public Optional<ContainerSignature> detect(byte[] data) {
        if (data == null || data.length < ContainerSignature.LENGTH) {
            return Optional.empty();
        }
        for (ContainerSignature signature : ContainerSignature.values()) {
            if (signature.matches(data)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }
}
