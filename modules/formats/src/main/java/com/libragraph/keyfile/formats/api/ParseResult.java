package com.libragraph.keyfile.formats.api;

import com.libragraph.keyfile.types.KeyFileFormat;

import java.util.Objects;

/**
 * Outcome of a single {@link KeyFormatParser} attempt.
 *
 * <p>A matched result hands ownership of {@code key} to the caller, who must
 * zero it when done.
 *
 * @param status  what happened
 * @param key     extracted key bytes (MATCHED only)
 * @param format  format that matched (MATCHED only)
 * @param reason  why the input was not this format (NOT_THIS_FORMAT only)
 * @param error   cause of a hard failure (FAILED only)
 */
public record ParseResult(
        Status status,
        byte[] key,
        KeyFileFormat format,
        String reason,
        RuntimeException error
) {

    public enum Status {
        MATCHED,
        NOT_THIS_FORMAT,
        FAILED
    }

    public static ParseResult matched(byte[] key, KeyFileFormat format) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
        return new ParseResult(Status.MATCHED, key, format, null, null);
    }

    public static ParseResult notThisFormat(String reason) {
        return new ParseResult(Status.NOT_THIS_FORMAT, null, null, reason, null);
    }

    public static ParseResult failed(RuntimeException error) {
        Objects.requireNonNull(error, "error cannot be null");
        return new ParseResult(Status.FAILED, null, null, error.getMessage(), error);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }

    @Override
    public String toString() {
        return switch (status) {
            case MATCHED -> "ParseResult[MATCHED " + format + ", " + key.length + " bytes]";
            case NOT_THIS_FORMAT -> "ParseResult[NOT_THIS_FORMAT: " + reason + "]";
            case FAILED -> "ParseResult[FAILED: " + reason + "]";
        };
    }
}
