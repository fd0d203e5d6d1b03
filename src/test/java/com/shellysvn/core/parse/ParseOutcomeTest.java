package com.shellysvn.core.parse;

import com.shellysvn.core.model.StatusResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseOutcomeTest {

    private final StatusReportParser statusParser = new StatusReportParser();

    @Test
    void successfulParse() {
        ParseOutcome<StatusResult> outcome = ParseOutcome.attempt(
                () -> statusParser.parse("<status><target path=\".\"/></status>", "."));

        assertTrue(outcome.isParsed());
        assertNull(outcome.error());
        assertEquals(".", outcome.value().path());
    }

    @Test
    void parseErrorIsCaptured() {
        ParseOutcome<StatusResult> outcome = ParseOutcome.attempt(
                () -> statusParser.parse("<status><target", "."));

        assertFalse(outcome.isParsed());
        assertNull(outcome.value());
        assertEquals("<status><target", outcome.error().getRawInput());
    }

    @Test
    void emptyInputIsAlsoCaptured() {
        ParseOutcome<?> outcome = ParseOutcome.attempt(() -> new InfoReportParser().parse(""));
        assertInstanceOf(SvnEmptyInputException.class, outcome.error());
    }

    @Test
    void otherExceptionsPropagate() {
        assertThrows(IllegalStateException.class, () -> ParseOutcome.attempt(() -> {
            throw new IllegalStateException("boom");
        }));
    }
}
