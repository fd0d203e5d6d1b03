package com.shellysvn.core.exec;

import java.time.Duration;

/**
 * Connection settings applied to every svn invocation.
 *
 * @param proxy             proxy to route through; {@link ProxySettings#disabled()} for none
 * @param connectionTimeout deadline for a single invocation; zero or null for none
 * @param sslVerify         false to accept the usual certificate failures non-interactively
 */
public record ExecutionContext(
    ProxySettings proxy,
    Duration connectionTimeout,
    boolean sslVerify
) {

    public ExecutionContext {
        if (proxy == null) {
            proxy = ProxySettings.disabled();
        }
        if (connectionTimeout == null || connectionTimeout.isNegative()) {
            connectionTimeout = Duration.ZERO;
        }
    }

    public static ExecutionContext defaults() {
        return new ExecutionContext(ProxySettings.disabled(), Duration.ZERO, true);
    }

    public boolean hasDeadline() {
        return !connectionTimeout.isZero();
    }
}
