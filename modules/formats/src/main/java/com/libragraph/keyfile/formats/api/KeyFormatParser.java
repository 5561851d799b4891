package com.libragraph.keyfile.formats.api;

import com.libragraph.keyfile.types.KeyFileFormat;

/**
 * Attempts to extract a key from the raw bytes of a key file.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 *
 * <p>Parsers never throw for input that simply is not in their format;
 * they return {@link ParseResult#notThisFormat(String)} so the resolver can
 * try the next one.
 */
public interface KeyFormatParser {

    /**
     * The encoding this parser recognizes.
     */
    KeyFileFormat format();

    /**
     * Higher priority is tried first.
     */
    int priority();

    /**
     * Parses the whole file.
     *
     * @param data raw file bytes; read-only, never retained
     * @return a matched key (owned by the caller), a soft miss, or a hard failure
     */
    ParseResult parse(byte[] data);
}
