package com.shellysvn.core.config;

import com.shellysvn.core.exec.ExecutionContext;
import com.shellysvn.core.exec.ProxySettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "shelly")
public class ShellyProperties {

    private Svn svn = new Svn();
    private Proxy proxy = new Proxy();

    // -- Svn accessors (delegate to nested) --
    public String getExecutable() { return svn.executable; }
    public int getLogLimit() { return svn.logLimit; }
    public int getConnectionTimeoutSeconds() { return svn.connectionTimeoutSeconds; }
    public boolean isSslVerify() { return svn.sslVerify; }

    /**
     * Connection settings for every svn invocation, built from the
     * {@code shelly.svn} and {@code shelly.proxy} sections.
     */
    public ExecutionContext toExecutionContext() {
        var proxySettings = new ProxySettings(proxy.enabled, proxy.host, proxy.port,
                proxy.username, proxy.password, proxy.bypassForLocal);
        return new ExecutionContext(proxySettings,
                Duration.ofSeconds(Math.max(0, svn.connectionTimeoutSeconds)), svn.sslVerify);
    }

    public Svn getSvn() { return svn; }
    public void setSvn(Svn svn) { this.svn = svn; }
    public Proxy getProxy() { return proxy; }
    public void setProxy(Proxy proxy) { this.proxy = proxy; }

    public static class Svn {
        private String executable = "svn";
        private int logLimit = 100;
        private int connectionTimeoutSeconds = 0;
        private boolean sslVerify = true;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public int getLogLimit() { return logLimit; }
        public void setLogLimit(int logLimit) { this.logLimit = logLimit; }
        public int getConnectionTimeoutSeconds() { return connectionTimeoutSeconds; }
        public void setConnectionTimeoutSeconds(int connectionTimeoutSeconds) { this.connectionTimeoutSeconds = connectionTimeoutSeconds; }
        public boolean isSslVerify() { return sslVerify; }
        public void setSslVerify(boolean sslVerify) { this.sslVerify = sslVerify; }
    }

    public static class Proxy {
        private boolean enabled = false;
        private String host = "";
        private int port = 0;
        private String username = "";
        private String password = "";
        private boolean bypassForLocal = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public boolean isBypassForLocal() { return bypassForLocal; }
        public void setBypassForLocal(boolean bypassForLocal) { this.bypassForLocal = bypassForLocal; }
    }
}
