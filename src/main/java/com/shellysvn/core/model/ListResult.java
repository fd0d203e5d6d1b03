package com.shellysvn.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Parsed {@code svn list --xml} report.
 */
public record ListResult(
    String path,
    List<ListEntry> entries
) implements Serializable {

    public ListResult {
        entries = List.copyOf(entries);
    }
}
