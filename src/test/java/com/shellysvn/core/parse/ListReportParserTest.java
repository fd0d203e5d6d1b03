package com.shellysvn.core.parse;

import com.shellysvn.core.model.ListEntry;
import com.shellysvn.core.model.ListResult;
import com.shellysvn.core.model.NodeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListReportParserTest {

    private static final String URL = "https://svn.example.com/repo/trunk";

    private final ListReportParser parser = new ListReportParser();

    @Test
    void listsLayout() {
        ListResult result = parser.parse("""
                <?xml version="1.0" encoding="UTF-8"?>
                <lists>
                <list path="https://svn.example.com/repo/trunk/">
                <entry kind="dir">
                <name>src</name>
                <commit revision="10"><author>alice</author><date>2024-01-01T00:00:00Z</date></commit>
                </entry>
                <entry kind="file">
                <name>README.md</name>
                <size>2048</size>
                <commit revision="12"><author>bob</author><date>2024-01-02T00:00:00Z</date></commit>
                </entry>
                </list>
                </lists>
                """, URL);

        assertEquals("https://svn.example.com/repo/trunk/", result.path());
        assertEquals(2, result.entries().size());

        ListEntry dir = result.entries().get(0);
        assertEquals("src", dir.name());
        assertEquals(NodeKind.DIR, dir.kind());
        assertNull(dir.size());
        assertEquals(10, dir.revision());
        assertEquals("alice", dir.author());
        assertEquals(URL + "/src", dir.path());

        ListEntry file = result.entries().get(1);
        assertEquals(NodeKind.FILE, file.kind());
        assertEquals(2048L, file.size());
        assertEquals("bob", file.author());
        assertEquals(URL + "/README.md", file.path());
    }

    @Test
    @DisplayName("a single entry and a bare list root are accepted")
    void bareListRoot() {
        ListResult result = parser.parse("""
                <list path="https://svn.example.com/repo">
                  <entry kind="file"><name>a.txt</name><commit revision="3"><author>c</author></commit></entry>
                </list>
                """, "ignored");

        assertEquals("https://svn.example.com/repo", result.path());
        assertEquals(1, result.entries().size());
        assertEquals("https://svn.example.com/repo/a.txt", result.entries().get(0).path());
        assertNull(result.entries().get(0).size());
    }

    @Test
    @DisplayName("a missing kind is treated as a file")
    void kindFallback() {
        ListResult result = parser.parse("""
                <lists><list path="p"><entry><name>x</name></entry><entry><name>y</name></entry></list></lists>
                """, "p");
        assertEquals(NodeKind.FILE, result.entries().get(0).kind());
        assertEquals(0, result.entries().get(0).revision());
    }

    @Test
    void emptyListing() {
        ListResult result = parser.parse("", URL);
        assertEquals(URL, result.path());
        assertTrue(result.entries().isEmpty());
    }

    @Test
    void joinStripsTrailingSlashes() {
        assertEquals("https://h/r/dir", ListReportParser.join("https://h/r/", "dir/"));
        assertEquals("name", ListReportParser.join("", "name"));
        assertEquals("name", ListReportParser.join(null, "name"));
    }
}
