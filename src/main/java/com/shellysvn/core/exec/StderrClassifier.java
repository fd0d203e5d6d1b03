package com.shellysvn.core.exec;

import java.util.List;
import java.util.Locale;

/**
 * Buckets svn diagnostic text into a {@link SvnFailureKind} by keyword.
 * Buckets are checked in declaration order; the first hit wins.
 */
public final class StderrClassifier {

    private static final List<String> AUTHENTICATION =
            List.of("authentication", "authorization", "access forbidden");
    private static final List<String> CONFLICT = List.of("conflict");
    private static final List<String> NETWORK = List.of("connection", "network", "timeout", "host");
    private static final List<String> WORKING_COPY = List.of("working copy", "locked", "cleanup");

    private StderrClassifier() {}

    public static SvnFailureKind classify(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return SvnFailureKind.GENERIC;
        }
        String lower = stderr.toLowerCase(Locale.ROOT);
        if (containsAny(lower, AUTHENTICATION)) {
            return SvnFailureKind.AUTHENTICATION;
        }
        if (containsAny(lower, CONFLICT)) {
            return SvnFailureKind.CONFLICT;
        }
        if (containsAny(lower, NETWORK)) {
            return SvnFailureKind.NETWORK;
        }
        if (containsAny(lower, WORKING_COPY)) {
            return SvnFailureKind.WORKING_COPY;
        }
        return SvnFailureKind.GENERIC;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
