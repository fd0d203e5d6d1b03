package com.shellysvn.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Descriptor of one versioned node from {@code svn info --xml}.
 *
 * @param workingCopyRoot absolute working-copy root, null when the target is a bare URL
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InfoResult(
    String path,
    String url,
    String repositoryRoot,
    String repositoryUuid,
    long revision,
    NodeKind nodeKind,
    String lastChangedAuthor,
    long lastChangedRevision,
    String lastChangedDate,
    String workingCopyRoot
) implements Serializable {}
