package com.shellysvn.core.model;

/**
 * Action recorded for a changed path in a log entry.
 */
public enum PathAction {
    ADDED('A'),
    DELETED('D'),
    MODIFIED('M'),
    REPLACED('R');

    private final char code;

    PathAction(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * @return the action for {@code raw}, {@link #MODIFIED} when missing or unrecognized
     */
    public static PathAction from(String raw) {
        if (raw == null || raw.isBlank()) {
            return MODIFIED;
        }
        return switch (raw.trim()) {
            case "A" -> ADDED;
            case "D" -> DELETED;
            case "R" -> REPLACED;
            default -> MODIFIED;
        };
    }
}
