package com.shellysvn.core.parse;

/**
 * Thrown when svn report output cannot be turned into a typed result.
 *
 * <p>Carries the raw report text so the failure can be replayed in a test.
 */
public class SvnParseException extends RuntimeException {

    private final String rawInput;

    public SvnParseException(String message, String rawInput) {
        super(message);
        this.rawInput = rawInput;
    }

    public SvnParseException(String message, String rawInput, Throwable cause) {
        super(message, cause);
        this.rawInput = rawInput;
    }

    /**
     * @return the report text that failed to parse, may be null or empty
     */
    public String getRawInput() {
        return rawInput;
    }
}
