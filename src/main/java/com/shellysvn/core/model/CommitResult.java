package com.shellysvn.core.model;

import java.io.Serializable;

/**
 * Outcome of {@code svn commit}; revision is 0 when nothing was committed.
 */
public record CommitResult(long revision) implements Serializable {}
