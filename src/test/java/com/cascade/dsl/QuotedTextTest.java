package com.cascade.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QuotedText and action splitting.
 */
class QuotedTextTest {

    @Test
    @DisplayName("Should split on separator outside quotes and parentheses only")
    void shouldSplitOutsideQuotesAndParens() {
        List<String> parts = QuotedText.split(
                "a is \"x and y\" and children(b is \"1\" and c is \"2\").d is \"3\" and e is \"4\"", " and ");

        assertEquals(List.of(
                "a is \"x and y\"",
                "children(b is \"1\" and c is \"2\").d is \"3\"",
                "e is \"4\""), parts);
    }

    @Test
    @DisplayName("Should find closing parenthesis ignoring quoted ones")
    void shouldFindClosingParen() {
        String text = "child(Title matches \".*(Test|QA).*\").State";

        assertEquals(text.indexOf(").State"), QuotedText.findClosingParen(text, 5));
        assertEquals(-1, QuotedText.findClosingParen("child(Title is \"x\"", 5));
    }

    @Test
    @DisplayName("Should recognise quoted literals")
    void shouldRecogniseQuotedLiterals() {
        assertTrue(QuotedText.isQuoted("\"Done\""));
        assertTrue(QuotedText.isQuoted("\"\""));
        assertFalse(QuotedText.isQuoted("\"a\" and \"b\""));
        assertFalse(QuotedText.isQuoted("Done"));
        assertEquals("Done", QuotedText.unquote("\"Done\""));
    }

    @Test
    @DisplayName("Should split actions at keywords but not inside quotes")
    void shouldSplitActions() {
        List<String> chunks = ActionParser.splitActions(
                "add \"Ready to set up\" to me.Tags remove \"Old\" from me.Tags set me.State = \"add\"");

        assertEquals(List.of(
                "add \"Ready to set up\" to me.Tags",
                "remove \"Old\" from me.Tags",
                "set me.State = \"add\""), chunks);
    }

    @Test
    @DisplayName("Should not split actions on keywords inside words")
    void shouldNotSplitInsideWords() {
        List<String> chunks = ActionParser.splitActions("set me.Custom.reset = \"x\" set me.addendum = \"y\"");

        assertEquals(2, chunks.size());
        assertEquals("set me.addendum = \"y\"", chunks.get(1));
    }
}
