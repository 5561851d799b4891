package com.libragraph.keyfile.formats.parsers;

import com.libragraph.keyfile.formats.api.KeyFormatParser;
import com.libragraph.keyfile.formats.api.ParseResult;
import com.libragraph.keyfile.types.KeyFileFormat;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Arrays;

/**
 * Parser for raw 32-byte key files. The file is the key.
 * Priority 200.
 */
@ApplicationScoped
public class BinaryKeyParser implements KeyFormatParser {

    public static final int KEY_LENGTH = 32;

    @Override
    public KeyFileFormat format() {
        return KeyFileFormat.BINARY_32;
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public ParseResult parse(byte[] data) {
        if (data == null || data.length != KEY_LENGTH) {
            return ParseResult.notThisFormat("length is not " + KEY_LENGTH);
        }
        return ParseResult.matched(Arrays.copyOf(data, KEY_LENGTH), KeyFileFormat.BINARY_32);
    }
}
