package com.shellysvn.core.model;

import java.io.Serializable;

/**
 * Outcome of {@code svn update}; revision is 0 when the output named none.
 */
public record UpdateResult(long revision) implements Serializable {}
