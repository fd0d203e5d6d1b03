package com.shellysvn.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A single commit from {@code svn log --xml}.
 *
 * @param revision committed revision
 * @param author   commit author, {@value #UNKNOWN_AUTHOR} when the commit was anonymous
 * @param date     commit timestamp as reported
 * @param message  log message, empty when none
 * @param paths    changed paths in report order
 */
public record LogEntry(
    long revision,
    String author,
    String date,
    String message,
    List<LogPath> paths
) implements Serializable {

    public static final String UNKNOWN_AUTHOR = "unknown";

    public LogEntry {
        paths = List.copyOf(paths);
    }
}
