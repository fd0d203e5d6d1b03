package com.shellysvn.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns svn XML reports into a uniform {@link JsonNode} tree.
 *
 * <p>Attributes and child elements are both plain fields of the element's
 * object node. Text that sits next to attributes is stored under
 * {@link #TEXT_KEY}. The root element itself is not part of the tree; its
 * attributes and children are the top-level fields.
 *
 * <p>Report items that may repeat are always arrays, even when the report
 * contains a single occurrence:
 * <ul>
 *   <li>{@code entry}, {@code logentry}, {@code target} and {@code list} anywhere</li>
 *   <li>{@code path} when it is a child of {@code paths}</li>
 * </ul>
 * {@code path} elsewhere is the attribute carrying a status or info path and
 * stays a scalar.
 */
public final class XmlReportNormalizer {

    public static final String TEXT_KEY = "#text";

    static final Set<String> LIST_ELEMENTS = Set.of("entry", "logentry", "target", "list");

    static final Map<String, String> NESTED_LIST_ELEMENTS = Map.of("paths", "path");

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
            .nameForTextElement(TEXT_KEY)
            .build();

    private XmlReportNormalizer() {}

    /**
     * Parses and normalizes a report.
     *
     * @param xml raw report text
     * @return the normalized tree, empty when {@code xml} is null or blank
     * @throws SvnParseException when the text is not well-formed XML
     */
    public static Optional<JsonNode> normalize(String xml) {
        if (xml == null || xml.isBlank()) {
            return Optional.empty();
        }
        requireWellFormed(xml);
        JsonNode root;
        try {
            root = XML_MAPPER.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new SvnParseException("Malformed XML report: " + e.getOriginalMessage(), xml, e);
        }
        if (root == null || root.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(coerceLists(root, null));
    }

    /**
     * Streams the whole document through the StAX reader. The tree reader
     * stops at the end of the first root element, so a second root or
     * trailing text would otherwise go unnoticed.
     */
    private static void requireWellFormed(String xml) {
        try {
            XMLStreamReader reader = XML_MAPPER.getFactory().getXMLInputFactory()
                    .createXMLStreamReader(new StringReader(xml));
            while (reader.hasNext()) {
                reader.next();
            }
            reader.close();
        } catch (XMLStreamException e) {
            throw new SvnParseException("Malformed XML report: " + e.getMessage(), xml, e);
        }
    }

    private static JsonNode coerceLists(JsonNode node, String parentName) {
        if (node.isArray()) {
            var array = JsonNodeFactory.instance.arrayNode(node.size());
            for (JsonNode item : node) {
                array.add(coerceLists(item, parentName));
            }
            return array;
        }
        if (!node.isObject()) {
            return node;
        }

        var result = JsonNodeFactory.instance.objectNode();
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        for (String name : names) {
            JsonNode child = node.get(name);
            JsonNode normalized = coerceLists(child, name);
            if (!child.isArray() && isListElement(name, parentName)) {
                normalized = singleton(normalized);
            }
            result.set(name, normalized);
        }
        return result;
    }

    private static boolean isListElement(String name, String parentName) {
        return LIST_ELEMENTS.contains(name)
                || (parentName != null && name.equals(NESTED_LIST_ELEMENTS.get(parentName)));
    }

    private static ArrayNode singleton(JsonNode node) {
        var array = JsonNodeFactory.instance.arrayNode(1);
        array.add(node);
        return array;
    }
}
