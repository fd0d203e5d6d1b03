package com.shellysvn.core.exec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class StderrClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "svn: E170001: Authentication failed                           | AUTHENTICATION",
            "svn: E170001: Authorization failed                            | AUTHENTICATION",
            "svn: E175013: Access forbidden                                | AUTHENTICATION",
            "svn: E155015: Commit failed: Aborting commit: 'a.txt' remains in conflict | CONFLICT",
            "svn: E170013: Unable to connect to a repository: connection refused| NETWORK",
            "svn: E670002: Name or service not known: host lookup failed   | NETWORK",
            "svn: E175012: Connection timed out                            | NETWORK",
            "svn: E155007: '/tmp/x' is not a working copy                  | WORKING_COPY",
            "svn: E155004: Run 'svn cleanup' to remove locks               | WORKING_COPY",
            "svn: E200009: Could not display info for all targets          | GENERIC"
    })
    void classifiesByKeyword(String stderr, SvnFailureKind expected) {
        assertEquals(expected, StderrClassifier.classify(stderr));
    }

    @Test
    @DisplayName("authentication wins over later buckets")
    void firstBucketWins() {
        assertEquals(SvnFailureKind.AUTHENTICATION,
                StderrClassifier.classify("Authentication failed: connection reset"));
    }

    @Test
    void blankIsGeneric() {
        assertEquals(SvnFailureKind.GENERIC, StderrClassifier.classify(null));
        assertEquals(SvnFailureKind.GENERIC, StderrClassifier.classify("  "));
    }
}
