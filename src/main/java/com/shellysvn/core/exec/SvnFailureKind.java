package com.shellysvn.core.exec;

/**
 * Broad category of a failed svn invocation, derived from its stderr.
 */
public enum SvnFailureKind {
    AUTHENTICATION,
    CONFLICT,
    NETWORK,
    WORKING_COPY,
    TIMEOUT,
    GENERIC
}
