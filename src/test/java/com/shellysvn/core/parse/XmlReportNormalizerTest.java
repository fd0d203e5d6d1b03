package com.shellysvn.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class XmlReportNormalizerTest {

    private static JsonNode normalize(String xml) {
        return XmlReportNormalizer.normalize(xml).orElseThrow();
    }

    @Test
    @DisplayName("a single entry element is wrapped in a list")
    void singleEntryBecomesList() {
        JsonNode root = normalize("""
                <status><target path="."><entry path="a.txt"/></target></status>
                """);

        JsonNode targets = root.get("target");
        assertTrue(targets.isArray());
        assertEquals(1, targets.size());
        JsonNode entries = targets.get(0).get("entry");
        assertTrue(entries.isArray());
        assertEquals(1, entries.size());
        assertEquals("a.txt", entries.get(0).get("path").asText());
    }

    @Test
    @DisplayName("repeated entry elements become a list of the same shape")
    void repeatedEntriesStayList() {
        JsonNode root = normalize("""
                <status><target path="."><entry path="a.txt"/><entry path="b.txt"/></target></status>
                """);

        JsonNode entries = root.get("target").get(0).get("entry");
        assertTrue(entries.isArray());
        assertEquals(2, entries.size());
        assertEquals("b.txt", entries.get(1).get("path").asText());
    }

    @Test
    void changedPathsUnderPathsAreAlwaysList() {
        JsonNode root = normalize("""
                <log><logentry revision="4">
                  <paths><path action="M" kind="file">/trunk/a.txt</path></paths>
                </logentry></log>
                """);

        JsonNode paths = root.get("logentry").get(0).get("paths").get("path");
        assertTrue(paths.isArray());
        assertEquals(1, paths.size());
        assertEquals("/trunk/a.txt", paths.get(0).get(XmlReportNormalizer.TEXT_KEY).asText());
        assertEquals("M", paths.get(0).get("action").asText());
    }

    @Test
    @DisplayName("a path attribute outside paths stays a scalar")
    void pathAttributeStaysScalar() {
        JsonNode root = normalize("<status><target path=\"/wc\"/></status>");

        JsonNode target = root.get("target").get(0);
        assertTrue(target.get("path").isValueNode());
        assertEquals("/wc", target.get("path").asText());
    }

    @Test
    void attributesAndChildrenAreSiblingFields() {
        JsonNode root = normalize("""
                <info><entry kind="dir" revision="12"><url>https://svn.example.com/repo</url></entry></info>
                """);

        JsonNode entry = root.get("entry").get(0);
        assertEquals("dir", entry.get("kind").asText());
        assertEquals("12", entry.get("revision").asText());
        assertEquals("https://svn.example.com/repo", entry.get("url").asText());
    }

    @Test
    void blankInputIsEmpty() {
        assertTrue(XmlReportNormalizer.normalize("").isEmpty());
        assertTrue(XmlReportNormalizer.normalize("  \n ").isEmpty());
        assertTrue(XmlReportNormalizer.normalize(null).isEmpty());
    }

    @Test
    @DisplayName("malformed XML raises a parse error carrying the input")
    void malformedXmlThrows() {
        String xml = "<status><target path=\".\">";
        var e = assertThrows(SvnParseException.class, () -> XmlReportNormalizer.normalize(xml));
        assertEquals(xml, e.getRawInput());
        assertTrue(e.getMessage().startsWith("Malformed XML report"));
    }

    @Test
    @DisplayName("a second root element is rejected")
    void multipleRootsThrow() {
        String xml = "<log><logentry revision=\"1\"/></log><log><logentry revision=\"2\"/></log>";
        var e = assertThrows(SvnParseException.class, () -> XmlReportNormalizer.normalize(xml));
        assertEquals(xml, e.getRawInput());
    }

    @Test
    @DisplayName("text after the root element is rejected")
    void trailingJunkThrows() {
        assertThrows(SvnParseException.class, () -> XmlReportNormalizer.normalize(
                "<status><target path=\".\" revision=\"4\"/></status>junk<<<"));
    }

    @Test
    void trailingWhitespaceIsAccepted() {
        assertTrue(XmlReportNormalizer.normalize("<status><target path=\".\"/></status>\n\n").isPresent());
    }
}
