package com.shellysvn.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Temporary svn configuration directory holding proxy settings.
 *
 * <p>Proxy credentials go into a {@code servers} file readable by the owner
 * only, never into the environment. The directory is removed on {@link #close()}.
 */
final class SvnConfigDirectory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SvnConfigDirectory.class);

    private static final SvnConfigDirectory NONE = new SvnConfigDirectory(null);

    private final Path path;

    private SvnConfigDirectory(Path path) {
        this.path = path;
    }

    /**
     * @return a directory for {@code proxy}, or one with a null {@link #path()} when no proxy applies
     */
    static SvnConfigDirectory forProxy(ProxySettings proxy) throws IOException {
        if (proxy == null || !proxy.isUsable()) {
            return NONE;
        }
        Path dir = Files.createTempDirectory("svn-config-");
        Path servers = dir.resolve("servers");
        Files.writeString(servers, serversFile(proxy), StandardCharsets.UTF_8);
        restrictToOwner(servers);
        log.debug("Wrote proxy configuration for {}:{} to {}", proxy.host(), proxy.port(), dir);
        return new SvnConfigDirectory(dir);
    }

    static String serversFile(ProxySettings proxy) {
        var lines = new ArrayList<String>();
        lines.add("[global]");
        lines.add("http-proxy-host = " + proxy.host());
        lines.add("http-proxy-port = " + proxy.port());
        if (proxy.username() != null && !proxy.username().isBlank()) {
            lines.add("http-proxy-username = " + proxy.username());
        }
        if (proxy.password() != null && !proxy.password().isEmpty()) {
            lines.add("http-proxy-password = " + proxy.password());
        }
        if (proxy.bypassForLocal()) {
            lines.add("http-proxy-exceptions = localhost, 127.0.0.1");
        }
        return String.join("\n", lines) + "\n";
    }

    Path path() {
        return path;
    }

    @Override
    public void close() {
        if (path == null) {
            return;
        }
        try (var walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up svn config directory {}: {}", path, e.getMessage());
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", file);
        }
    }
}
