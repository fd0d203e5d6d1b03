package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.shellysvn.core.model.LockInfo;
import com.shellysvn.core.model.StatusChar;
import com.shellysvn.core.model.StatusEntry;
import com.shellysvn.core.model.StatusResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.shellysvn.core.parse.ReportValues.child;
import static com.shellysvn.core.parse.ReportValues.firstNonEmpty;
import static com.shellysvn.core.parse.ReportValues.has;
import static com.shellysvn.core.parse.ReportValues.list;
import static com.shellysvn.core.parse.ReportValues.number;
import static com.shellysvn.core.parse.ReportValues.optionalText;
import static com.shellysvn.core.parse.ReportValues.text;

/**
 * Parses {@code svn status --xml} reports.
 *
 * <p>Blank output and reports without a {@code target} (some clients omit it
 * for a clean working copy) are empty results, not errors. Entries keep
 * report order.
 */
public class StatusReportParser {

    private static final Logger log = LoggerFactory.getLogger(StatusReportParser.class);

    /**
     * @param xml      raw report, may be blank
     * @param basePath the queried working-copy path, echoed in the result
     * @throws SvnParseException when the report is malformed
     */
    public StatusResult parse(String xml, String basePath) {
        Optional<JsonNode> root = XmlReportNormalizer.normalize(xml);
        if (root.isEmpty()) {
            return StatusResult.empty(basePath);
        }
        try {
            return extract(root.get(), basePath);
        } catch (SvnParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SvnParseException("Failed to parse svn status report", xml, e);
        }
    }

    private StatusResult extract(JsonNode root, String basePath) {
        List<JsonNode> targets = list(root, "target");
        if (targets.isEmpty()) {
            log.debug("Status report for {} has no target element", basePath);
            return StatusResult.empty(basePath);
        }

        var entries = new ArrayList<StatusEntry>();
        for (JsonNode target : targets) {
            for (JsonNode entry : list(target, "entry")) {
                entries.add(toEntry(entry));
            }
        }
        return new StatusResult(basePath, entries, targetRevision(targets.get(0)));
    }

    private StatusEntry toEntry(JsonNode entry) {
        JsonNode wcStatus = child(entry, "wc-status");
        StatusChar status = StatusChar.from(optionalText(wcStatus, "item"));
        StatusChar propsStatus = StatusChar.from(optionalText(wcStatus, "props"));

        Long revision = null;
        String author = null;
        String date = null;
        if (has(wcStatus, "commit")) {
            JsonNode commit = child(wcStatus, "commit");
            revision = number(commit, "revision");
            author = text(commit, "author");
            date = text(commit, "date");
        }

        LockInfo lock = null;
        if (has(wcStatus, "lock")) {
            JsonNode lockNode = child(wcStatus, "lock");
            lock = new LockInfo(
                    text(lockNode, "owner"),
                    text(lockNode, "comment"),
                    firstNonEmpty(lockNode, "", "created", "creation-date"));
        }

        return new StatusEntry(text(entry, "path"), status, revision, author, date,
                false, propsStatus, lock);
    }

    private static long targetRevision(JsonNode target) {
        if (has(target, "revision")) {
            return number(target, "revision");
        }
        // status -u reports the base revision on <against>
        return number(child(target, "against"), "revision");
    }
}
