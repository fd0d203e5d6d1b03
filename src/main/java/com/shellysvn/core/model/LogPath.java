package com.shellysvn.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * A path changed by a commit.
 *
 * @param action           what the commit did to the path
 * @param path             repository path
 * @param copyFromPath     copy source, or null
 * @param copyFromRevision copy source revision, or null
 * @param kind             node kind when the client reported one, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogPath(
    PathAction action,
    String path,
    String copyFromPath,
    Long copyFromRevision,
    NodeKind kind
) implements Serializable {}
