package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.shellysvn.core.model.InfoResult;
import com.shellysvn.core.model.NodeKind;

import java.util.List;

import static com.shellysvn.core.parse.ReportValues.child;
import static com.shellysvn.core.parse.ReportValues.firstNonEmpty;
import static com.shellysvn.core.parse.ReportValues.list;
import static com.shellysvn.core.parse.ReportValues.number;
import static com.shellysvn.core.parse.ReportValues.optionalText;
import static com.shellysvn.core.parse.ReportValues.text;

/**
 * Parses {@code svn info --xml} reports into a single node descriptor.
 *
 * <p>Unlike status and log there is no meaningful empty answer: blank output
 * or a report without a node raises {@link SvnEmptyInputException}.
 */
public class InfoReportParser {

    /** Fields that identify a node when they sit directly under {@code <info>}. */
    static final List<String> NODE_FIELDS = List.of("path", "url", "kind", "revision");

    /**
     * @param xml raw report
     * @throws SvnEmptyInputException when the report describes no node
     * @throws SvnParseException      when the report is malformed
     */
    public InfoResult parse(String xml) {
        JsonNode root = XmlReportNormalizer.normalize(xml)
                .orElseThrow(() -> new SvnEmptyInputException("Empty svn info report", xml));
        JsonNode entry = describedNode(root, xml);
        try {
            return extract(root, entry);
        } catch (RuntimeException e) {
            throw new SvnParseException("Failed to parse svn info report", xml, e);
        }
    }

    private static JsonNode describedNode(JsonNode root, String xml) {
        List<JsonNode> entries = list(root, "entry");
        if (!entries.isEmpty()) {
            return entries.get(0);
        }
        // older layouts put the node fields straight under <info>
        for (String key : NODE_FIELDS) {
            if (optionalText(root, key) != null) {
                return root;
            }
        }
        throw new SvnEmptyInputException("No entry element in svn info report", xml);
    }

    private InfoResult extract(JsonNode root, JsonNode entry) {
        JsonNode repository = child(entry, "repository");
        JsonNode commit = child(entry, "commit");

        String url = firstNonEmpty(entry, null, "url");
        if (url == null) {
            url = text(repository, "url");
        }

        String workingCopyRoot = optionalText(child(entry, "wc-info"), "wcroot-abspath");
        if (workingCopyRoot == null) {
            workingCopyRoot = optionalText(root, "wc-root-abspath");
        }

        return new InfoResult(
                text(entry, "path"),
                url,
                text(repository, "root"),
                text(repository, "uuid"),
                number(entry, "revision"),
                NodeKind.from(optionalText(entry, "kind"), NodeKind.DIR),
                text(commit, "author"),
                number(commit, "revision"),
                text(commit, "date"),
                workingCopyRoot);
    }
}
