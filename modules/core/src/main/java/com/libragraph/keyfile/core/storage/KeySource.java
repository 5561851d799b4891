package com.libragraph.keyfile.core.storage;

import java.util.Objects;

/**
 * Logical location of a key file: a local path or a remote locator.
 * Kept next to the key for display and auditing only.
 *
 * @param locator path or URL as entered by the user
 */
public record KeySource(String locator) {

    public KeySource {
        Objects.requireNonNull(locator, "locator cannot be null");
        if (locator.isBlank()) {
            throw new IllegalArgumentException("Key source locator cannot be blank");
        }
    }

    public static KeySource of(String locator) {
        return new KeySource(locator);
    }

    /**
     * True for locators with a URL scheme other than {@code file}.
     */
    public boolean isRemote() {
        int schemeEnd = locator.indexOf("://");
        if (schemeEnd <= 1) {
            return false;
        }
        return !locator.substring(0, schemeEnd).equalsIgnoreCase("file");
    }

    /**
     * Last path segment, for display.
     */
    public String displayName() {
        String trimmed = locator.replaceAll("[/\\\\]+$", "");
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    @Override
    public String toString() {
        return locator;
    }
}
