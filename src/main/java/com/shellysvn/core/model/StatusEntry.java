package com.shellysvn.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Status of a single path in a working copy.
 *
 * <p>{@code revision}, {@code author} and {@code date} describe the last commit
 * and are null unless the report carried a commit node. {@code propsStatus} is
 * null when properties are unmodified.
 *
 * @param path        path as reported
 * @param status      item status
 * @param revision    last committed revision, or null
 * @param author      last commit author, or null
 * @param date        last commit date, or null
 * @param isDirectory always false here; directory detection needs the filesystem
 * @param propsStatus property status, or null when {@link StatusChar#NONE}
 * @param lock        lock details, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusEntry(
    String path,
    StatusChar status,
    Long revision,
    String author,
    String date,
    boolean isDirectory,
    StatusChar propsStatus,
    LockInfo lock
) implements Serializable {

    public StatusEntry {
        if (propsStatus == StatusChar.NONE) {
            propsStatus = null;
        }
    }
}
