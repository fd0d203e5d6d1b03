package com.shellysvn.core.parse;

/**
 * Thrown when a report that must describe something came back empty.
 * Only info parsing treats empty output as an error.
 */
public class SvnEmptyInputException extends SvnParseException {

    public SvnEmptyInputException(String message, String rawInput) {
        super(message, rawInput);
    }
}
