package com.libragraph.keyfile.core.resolve;

import com.libragraph.keyfile.formats.registry.KeyFormatRegistry;
import com.libragraph.keyfile.formats.registry.TestKeyFormatRegistries;
import com.libragraph.keyfile.formats.signature.ContainerSignatureChecker;

/**
 * Wires {@link KeyResolver} by hand for tests that run without CDI.
 */
public final class TestKeyResolvers {

    private TestKeyResolvers() {
    }

    public static KeyResolver with(KeyFormatRegistry registry) {
        KeyResolver resolver = new KeyResolver();
        resolver.signatureChecker = new ContainerSignatureChecker();
        resolver.registry = registry;
        return resolver;
    }

    public static KeyResolver builtIn() {
        return with(TestKeyFormatRegistries.builtIn());
    }
}
