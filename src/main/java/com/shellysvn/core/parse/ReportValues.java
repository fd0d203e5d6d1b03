package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated conversions from a normalized report tree to Java values.
 *
 * <p>Every accessor tolerates missing keys, null nodes and non-object parents.
 * Numbers default to 0 and never come back null; text falls back to the
 * caller's default.
 */
public final class ReportValues {

    private ReportValues() {}

    /**
     * @return the child node, or {@link MissingNode} when absent or when {@code node} is not an object
     */
    public static JsonNode child(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return MissingNode.getInstance();
        }
        return node.path(key);
    }

    /**
     * Element text of {@code node}, whether it is a bare value or an object
     * whose text sits under {@link XmlReportNormalizer#TEXT_KEY}.
     *
     * @return the text, or null when the node has none
     */
    public static String nodeText(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            return node.isEmpty() ? null : nodeText(node.get(0));
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        JsonNode text = node.path(XmlReportNormalizer.TEXT_KEY);
        return text.isValueNode() ? text.asText() : null;
    }

    public static String text(JsonNode node, String key, String defaultValue) {
        String value = nodeText(child(node, key));
        return value == null ? defaultValue : value;
    }

    public static String text(JsonNode node, String key) {
        return text(node, key, "");
    }

    /**
     * @return the text under {@code key}, or null when absent or blank
     */
    public static String optionalText(JsonNode node, String key) {
        String value = nodeText(child(node, key));
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * @return the first non-blank text among {@code keys}, probed in order, or {@code defaultValue}
     */
    public static String firstNonEmpty(JsonNode node, String defaultValue, String... keys) {
        for (String key : keys) {
            String value = optionalText(node, key);
            if (value != null) {
                return value;
            }
        }
        return defaultValue;
    }

    public static long number(JsonNode node, String key) {
        return toNumber(nodeText(child(node, key)));
    }

    /**
     * @return the number under {@code key}, null when the key is absent or blank, 0 when not numeric
     */
    public static Long optionalNumber(JsonNode node, String key) {
        String value = optionalText(node, key);
        return value == null ? null : toNumber(value);
    }

    /**
     * @return {@code value} as a long, 0 when null, blank, non-numeric or out of range
     */
    public static long toNumber(String value) {
        if (value == null) {
            return 0;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Items under {@code key} as a list: an array yields its elements, a single
     * node yields itself, a missing key yields nothing. Null items are dropped.
     */
    public static List<JsonNode> list(JsonNode node, String key) {
        JsonNode value = child(node, key);
        var items = new ArrayList<JsonNode>();
        if (value.isMissingNode() || value.isNull()) {
            return items;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (item != null && !item.isNull()) {
                    items.add(item);
                }
            }
        } else {
            items.add(value);
        }
        return items;
    }

    /**
     * @return true when {@code key} names a present node other than JSON null
     */
    public static boolean has(JsonNode node, String key) {
        JsonNode value = child(node, key);
        return !value.isMissingNode() && !value.isNull();
    }
}
