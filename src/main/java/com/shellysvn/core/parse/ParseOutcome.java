package com.shellysvn.core.parse;

import java.util.function.Supplier;

/**
 * Result of a parse attempt: either a value or the structural error.
 *
 * @param value parsed result, null on failure
 * @param error parse failure, null on success
 */
public record ParseOutcome<T>(T value, SvnParseException error) {

    public static <T> ParseOutcome<T> parsed(T value) {
        return new ParseOutcome<>(value, null);
    }

    public static <T> ParseOutcome<T> failed(SvnParseException error) {
        return new ParseOutcome<>(null, error);
    }

    /**
     * Runs {@code parse}, capturing an {@link SvnParseException} as a failed outcome.
     * Other exceptions propagate.
     */
    public static <T> ParseOutcome<T> attempt(Supplier<T> parse) {
        try {
            return parsed(parse.get());
        } catch (SvnParseException e) {
            return failed(e);
        }
    }

    public boolean isParsed() {
        return error == null;
    }
}
