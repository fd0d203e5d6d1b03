package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.shellysvn.core.model.ListEntry;
import com.shellysvn.core.model.ListResult;
import com.shellysvn.core.model.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.shellysvn.core.parse.ReportValues.child;
import static com.shellysvn.core.parse.ReportValues.list;
import static com.shellysvn.core.parse.ReportValues.number;
import static com.shellysvn.core.parse.ReportValues.optionalNumber;
import static com.shellysvn.core.parse.ReportValues.optionalText;
import static com.shellysvn.core.parse.ReportValues.text;

/**
 * Parses {@code svn list --xml} reports for repository browsing.
 *
 * <p>Accepts the {@code <lists><list path="...">} layout as well as a bare
 * {@code <list>} root.
 */
public class ListReportParser {

    /**
     * @param xml        raw report, may be blank
     * @param listedPath the URL or path that was listed
     * @throws SvnParseException when the report is malformed
     */
    public ListResult parse(String xml, String listedPath) {
        Optional<JsonNode> root = XmlReportNormalizer.normalize(xml);
        if (root.isEmpty()) {
            return new ListResult(listedPath, List.of());
        }
        try {
            return extract(root.get(), listedPath);
        } catch (SvnParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SvnParseException("Failed to parse svn list report", xml, e);
        }
    }

    private ListResult extract(JsonNode root, String listedPath) {
        List<JsonNode> lists = list(root, "list");
        List<JsonNode> containers = lists.isEmpty() ? List.of(root) : lists;

        String resultPath = pathOf(containers.get(0), listedPath);
        var entries = new ArrayList<ListEntry>();
        for (JsonNode container : containers) {
            String containerPath = pathOf(container, resultPath);
            for (JsonNode entry : list(container, "entry")) {
                entries.add(toEntry(entry, containerPath));
            }
        }
        return new ListResult(resultPath, entries);
    }

    private ListEntry toEntry(JsonNode entry, String containerPath) {
        String name = text(entry, "name");
        NodeKind kind = NodeKind.from(optionalText(entry, "kind"), NodeKind.FILE);
        String path = optionalText(entry, "path");
        JsonNode commit = child(entry, "commit");

        return new ListEntry(
                name,
                path != null ? path : join(containerPath, name),
                kind,
                kind == NodeKind.FILE ? optionalNumber(entry, "size") : null,
                number(commit, "revision"),
                text(commit, "author"),
                text(commit, "date"));
    }

    private static String pathOf(JsonNode container, String fallback) {
        String path = optionalText(container, "path");
        return path != null ? path : fallback;
    }

    static String join(String base, String name) {
        String cleanName = name.endsWith("/") ? name.substring(0, name.length() - 1) : name;
        if (base == null || base.isEmpty()) {
            return cleanName;
        }
        String cleanBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return cleanBase + "/" + cleanName;
    }
}
