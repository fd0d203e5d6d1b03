package com.shellysvn.core.exec;

/**
 * HTTP proxy the svn client should go through.
 *
 * @param bypassForLocal skip the proxy for localhost and 127.0.0.1
 */
public record ProxySettings(
    boolean enabled,
    String host,
    int port,
    String username,
    String password,
    boolean bypassForLocal
) {

    public static ProxySettings disabled() {
        return new ProxySettings(false, "", 0, "", "", false);
    }

    /**
     * @return true when enabled with a host and a port
     */
    public boolean isUsable() {
        return enabled && host != null && !host.isBlank() && port > 0;
    }

    @Override
    public String toString() {
        return "ProxySettings[enabled=%s, host=%s, port=%d, username=%s, password=%s, bypassForLocal=%s]"
                .formatted(enabled, host, port, username,
                        password == null || password.isEmpty() ? "" : "***", bypassForLocal);
    }
}
