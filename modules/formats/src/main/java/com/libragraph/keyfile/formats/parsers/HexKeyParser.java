package com.libragraph.keyfile.formats.parsers;

import com.libragraph.keyfile.formats.api.KeyFormatParser;
import com.libragraph.keyfile.formats.api.ParseResult;
import com.libragraph.keyfile.types.KeyFileFormat;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.HexFormat;

/**
 * Parser for 64-character hex key files (either case), decoding to 32 bytes.
 * Priority 100.
 *
 * <p>Decodes straight from the bytes so no immutable String copy of the key
 * is left behind. A byte outside the ASCII hex digits is a soft miss; multi-byte
 * UTF-8 sequences can never be hex digits.
 */
@ApplicationScoped
public class HexKeyParser implements KeyFormatParser {

    public static final int TEXT_LENGTH = 64;

    @Override
    public KeyFileFormat format() {
        return KeyFileFormat.HEX_64;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public ParseResult parse(byte[] data) {
        if (data == null || data.length != TEXT_LENGTH) {
            return ParseResult.notThisFormat("length is not " + TEXT_LENGTH);
        }
        for (byte b : data) {
            if (!HexFormat.isHexDigit(b)) {
                return ParseResult.notThisFormat("non-hex character in 64-byte file");
            }
        }

        byte[] key = new byte[TEXT_LENGTH / 2];
        for (int i = 0; i < key.length; i++) {
            int hi = HexFormat.fromHexDigit(data[2 * i]);
            int lo = HexFormat.fromHexDigit(data[2 * i + 1]);
            key[i] = (byte) ((hi << 4) | lo);
        }
        return ParseResult.matched(key, KeyFileFormat.HEX_64);
    }
}
