package com.shellysvn.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * One entry of a repository listing.
 *
 * @param name     entry name as listed
 * @param path     full path or URL of the entry
 * @param kind     file or directory
 * @param size     size in bytes for files, null for directories
 * @param revision revision of the last change
 * @param author   author of the last change
 * @param date     date of the last change
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListEntry(
    String name,
    String path,
    NodeKind kind,
    Long size,
    long revision,
    String author,
    String date
) implements Serializable {}
