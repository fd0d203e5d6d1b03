package com.shellysvn.core.model;

import java.util.Locale;

/**
 * Closed set of working-copy status codes reported by {@code svn status}.
 *
 * <p>Reports have used both the one-symbol code ({@code M}) and the word form
 * ({@code modified}). Anything outside this set normalizes to {@link #NONE}.
 */
public enum StatusChar {
    NONE(' ', "none"),
    ADDED('A', "added"),
    CONFLICTED('C', "conflicted"),
    DELETED('D', "deleted"),
    IGNORED('I', "ignored"),
    MODIFIED('M', "modified"),
    REPLACED('R', "replaced"),
    EXTERNAL('X', "external"),  // unversioned directory created by an externals definition
    UNVERSIONED('?', "unversioned"),
    MISSING('!', "missing"),
    OBSTRUCTED('~', "obstructed");

    private final char symbol;
    private final String word;

    StatusChar(char symbol, String word) {
        this.symbol = symbol;
        this.word = word;
    }

    public char symbol() {
        return symbol;
    }

    public String word() {
        return word;
    }

    /**
     * Resolves a raw report value to a status code.
     *
     * @param raw one-symbol code or word form, may be null
     * @return the matching code, {@link #NONE} for anything unrecognized
     */
    public static StatusChar from(String raw) {
        if (raw == null || raw.isEmpty()) {
            return NONE;
        }
        if (raw.length() == 1) {
            char c = raw.charAt(0);
            for (StatusChar status : values()) {
                if (status.symbol == c) {
                    return status;
                }
            }
            return NONE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("normal".equals(normalized)) {
            return NONE;
        }
        for (StatusChar status : values()) {
            if (status.word.equals(normalized)) {
                return status;
            }
        }
        return NONE;
    }
}
