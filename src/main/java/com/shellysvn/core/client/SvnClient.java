package com.shellysvn.core.client;

import com.shellysvn.core.exec.SvnCommandRunner;
import com.shellysvn.core.model.CommitResult;
import com.shellysvn.core.model.InfoResult;
import com.shellysvn.core.model.ListResult;
import com.shellysvn.core.model.LogResult;
import com.shellysvn.core.model.StatusResult;
import com.shellysvn.core.model.UpdateResult;
import com.shellysvn.core.parse.InfoReportParser;
import com.shellysvn.core.parse.ListReportParser;
import com.shellysvn.core.parse.LogReportParser;
import com.shellysvn.core.parse.ReportValues;
import com.shellysvn.core.parse.StatusReportParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for svn operations.
 *
 * <p>Builds the argument vector for each operation, runs it through the
 * {@link SvnCommandRunner} and hands the captured report to the matching
 * parser. Holds no state between calls, so one instance can serve concurrent
 * callers. Serializing writes to a single working copy is the caller's job.
 */
public class SvnClient {

    private static final Logger log = LoggerFactory.getLogger(SvnClient.class);

    public static final int DEFAULT_LOG_LIMIT = 100;

    static final Pattern UPDATED_REVISION = Pattern.compile("(?:Updated to|At) revision (\\d+)\\.");
    static final Pattern COMMITTED_REVISION = Pattern.compile("Committed revision (\\d+)\\.");

    /**
     * Depth accepted by {@code svn list --depth}.
     */
    public enum Depth {
        EMPTY, FILES, IMMEDIATES, INFINITY;

        public String argument() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final SvnCommandRunner runner;
    private final StatusReportParser statusParser = new StatusReportParser();
    private final LogReportParser logParser = new LogReportParser();
    private final InfoReportParser infoParser = new InfoReportParser();
    private final ListReportParser listParser = new ListReportParser();

    public SvnClient(SvnCommandRunner runner) {
        this.runner = runner;
    }

    /**
     * Working-copy status of {@code path}.
     */
    public StatusResult status(String path) {
        String xml = runner.run(List.of("status", "--xml", path), workingDirFor(path));
        return statusParser.parse(xml, path);
    }

    /**
     * Commit history of {@code path}, newest first.
     *
     * @param limit         maximum number of entries
     * @param startRevision first revision of the range, or null
     * @param endRevision   last revision of the range, or null for HEAD; ignored without a start
     */
    public LogResult log(String path, int limit, Long startRevision, Long endRevision) {
        var args = new ArrayList<>(List.of("log", "--xml", "--verbose", "-l", String.valueOf(limit)));
        if (startRevision != null && endRevision != null) {
            args.add("-r");
            args.add(startRevision + ":" + endRevision);
        } else if (startRevision != null) {
            args.add("-r");
            args.add(startRevision + ":HEAD");
        }
        args.add(path);
        return logParser.parse(runner.run(args, workingDirFor(path)));
    }

    public LogResult log(String path) {
        return log(path, DEFAULT_LOG_LIMIT, null, null);
    }

    /**
     * Node descriptor for a working-copy path or repository URL.
     */
    public InfoResult info(String target) {
        String xml = runner.run(List.of("info", "--xml", target), workingDirFor(target));
        return infoParser.parse(xml);
    }

    /**
     * Repository listing of {@code url}.
     *
     * @param revision revision to list, or null for HEAD
     * @param depth    listing depth, or null for svn's default
     */
    public ListResult list(String url, String revision, Depth depth) {
        var args = new ArrayList<>(List.of("list", "--xml", "-v"));
        if (revision != null && !revision.isBlank()) {
            args.add("-r");
            args.add(revision);
        }
        if (depth != null) {
            args.add("--depth");
            args.add(depth.argument());
        }
        args.add(url);
        return listParser.parse(runner.run(args, workingDirFor(url)), url);
    }

    public UpdateResult update(String path) {
        String output = runner.run(List.of("update", path), workingDirFor(path));
        return new UpdateResult(scrapeRevision(UPDATED_REVISION, output));
    }

    public CommitResult commit(List<String> paths, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Commit message is required");
        }
        requirePaths(paths, "commit");
        var args = new ArrayList<>(List.of("commit", "-m", message));
        args.addAll(paths);
        String output = runner.run(args, workingDirFor(paths.get(0)));
        long revision = scrapeRevision(COMMITTED_REVISION, output);
        log.info("Committed {} path(s) as revision {}", paths.size(), revision);
        return new CommitResult(revision);
    }

    public void revert(List<String> paths) {
        runOnPaths("revert", paths);
    }

    public void add(List<String> paths) {
        runOnPaths("add", paths);
    }

    public void delete(List<String> paths) {
        runOnPaths("delete", paths);
    }

    public void cleanup(String path) {
        runner.run(List.of("cleanup", path), workingDirFor(path));
    }

    private void runOnPaths(String subcommand, List<String> paths) {
        requirePaths(paths, subcommand);
        var args = new ArrayList<String>();
        args.add(subcommand);
        args.addAll(paths);
        runner.run(args, workingDirFor(paths.get(0)));
    }

    private static void requirePaths(List<String> paths, String subcommand) {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("No paths specified for " + subcommand);
        }
    }

    static long scrapeRevision(Pattern pattern, String output) {
        if (output == null) {
            return 0;
        }
        Matcher matcher = pattern.matcher(output);
        return matcher.find() ? ReportValues.toNumber(matcher.group(1)) : 0;
    }

    /**
     * Directory to run svn in for an absolute local target: the target itself
     * when it is a directory, else its parent when that exists. Relative paths
     * and URLs run in the current directory (null).
     */
    static Path workingDirFor(String target) {
        if (target == null || target.isBlank() || target.contains("://")) {
            return null;
        }
        try {
            Path path = Path.of(target);
            if (!path.isAbsolute()) {
                return null;
            }
            if (Files.isDirectory(path)) {
                return path;
            }
            Path parent = path.getParent();
            return parent != null && Files.isDirectory(parent) ? parent : null;
        } catch (InvalidPathException e) {
            log.debug("Not a local path: {}", target);
            return null;
        }
    }
}
