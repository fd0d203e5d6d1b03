package com.shellysvn.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Parsed {@code svn status --xml} report.
 *
 * @param path     queried root
 * @param entries  entries in report order
 * @param revision base revision of the queried target, 0 when not reported
 */
public record StatusResult(
    String path,
    List<StatusEntry> entries,
    long revision
) implements Serializable {

    public StatusResult {
        entries = List.copyOf(entries);
    }

    public static StatusResult empty(String path) {
        return new StatusResult(path, List.of(), 0);
    }
}
