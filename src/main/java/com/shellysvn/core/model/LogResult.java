package com.shellysvn.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Parsed commit history.
 *
 * @param entries       commits, newest first
 * @param startRevision lowest revision in {@code entries}, 0 when empty
 * @param endRevision   highest revision in {@code entries}, 0 when empty
 */
public record LogResult(
    List<LogEntry> entries,
    long startRevision,
    long endRevision
) implements Serializable {

    public LogResult {
        entries = List.copyOf(entries);
    }

    public static LogResult empty() {
        return new LogResult(List.of(), 0, 0);
    }
}
