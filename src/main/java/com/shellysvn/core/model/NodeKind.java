package com.shellysvn.core.model;

import java.util.Locale;

/**
 * Kind of a versioned node.
 */
public enum NodeKind {
    FILE,
    DIR;

    /**
     * Resolves a raw {@code kind} attribute.
     *
     * @param raw      value from the report, may be null
     * @param fallback kind to use when {@code raw} is neither {@code file} nor {@code dir}
     */
    public static NodeKind from(String raw, NodeKind fallback) {
        if (raw == null) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> FILE;
            case "dir" -> DIR;
            default -> fallback;
        };
    }
}
