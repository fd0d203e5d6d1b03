package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.shellysvn.core.model.LogEntry;
import com.shellysvn.core.model.LogPath;
import com.shellysvn.core.model.LogResult;
import com.shellysvn.core.model.NodeKind;
import com.shellysvn.core.model.PathAction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Optional;

import static com.shellysvn.core.parse.ReportValues.child;
import static com.shellysvn.core.parse.ReportValues.firstNonEmpty;
import static com.shellysvn.core.parse.ReportValues.list;
import static com.shellysvn.core.parse.ReportValues.nodeText;
import static com.shellysvn.core.parse.ReportValues.number;
import static com.shellysvn.core.parse.ReportValues.optionalNumber;
import static com.shellysvn.core.parse.ReportValues.optionalText;
import static com.shellysvn.core.parse.ReportValues.text;

/**
 * Parses {@code svn log --xml} reports.
 *
 * <p>Entries are always returned newest first regardless of the order in the
 * report. The commit message has been reported as {@code msg} and as
 * {@code message}; the first non-empty one wins.
 */
public class LogReportParser {

    static final String[] MESSAGE_KEYS = {"msg", "message"};

    private static final Comparator<LogEntry> NEWEST_FIRST =
            Comparator.comparingLong(LogEntry::revision).reversed();

    /**
     * @param xml raw report, may be blank
     * @throws SvnParseException when the report is malformed
     */
    public LogResult parse(String xml) {
        Optional<JsonNode> root = XmlReportNormalizer.normalize(xml);
        if (root.isEmpty()) {
            return LogResult.empty();
        }
        try {
            return extract(root.get());
        } catch (SvnParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SvnParseException("Failed to parse svn log report", xml, e);
        }
    }

    private LogResult extract(JsonNode root) {
        var entries = new ArrayList<LogEntry>();
        for (JsonNode entry : list(root, "logentry")) {
            entries.add(toEntry(entry));
        }
        if (entries.isEmpty()) {
            return LogResult.empty();
        }

        entries.sort(NEWEST_FIRST);
        long start = entries.stream().mapToLong(LogEntry::revision).min().orElse(0);
        long end = entries.stream().mapToLong(LogEntry::revision).max().orElse(0);
        return new LogResult(entries, start, end);
    }

    private LogEntry toEntry(JsonNode entry) {
        var paths = new ArrayList<LogPath>();
        for (JsonNode path : list(child(entry, "paths"), "path")) {
            paths.add(toPath(path));
        }
        return new LogEntry(
                number(entry, "revision"),
                firstNonEmpty(entry, LogEntry.UNKNOWN_AUTHOR, "author"),
                text(entry, "date"),
                firstNonEmpty(entry, "", MESSAGE_KEYS),
                paths);
    }

    private LogPath toPath(JsonNode path) {
        String value = nodeText(path);
        if (value == null || value.isBlank()) {
            value = text(path, "path");
        }
        String kind = optionalText(path, "kind");
        return new LogPath(
                PathAction.from(optionalText(path, "action")),
                value,
                optionalText(path, "copyfrom-path"),
                optionalNumber(path, "copyfrom-rev"),
                kind == null ? null : NodeKind.from(kind, null));
    }
}
