package me.christianrobert.semgraph.util;

import org.junit.jupiter.api.Test;

import static me.christianrobert.semgraph.source.SourceNode.*;
import static org.junit.jupiter.api.Assertions.*;

class SourceTreeFormatterTest {

    @Test
    void indentsChildren() {
        String text = SourceTreeFormatter.format(op("and",
                op(">", var("x"), integer(5)),
                op("<", var("y"), integer(10))));

        String expected = "OPERATOR and\n"
                + "  OPERATOR >\n"
                + "    VARIABLE x\n"
                + "    LITERAL integer 5\n"
                + "  OPERATOR <\n"
                + "    VARIABLE y\n"
                + "    LITERAL integer 10\n";
        assertEquals(expected, text);
    }

    @Test
    void showsPositionAndTruncatesLongValues() {
        String text = SourceTreeFormatter.format(string("a".repeat(80)).at(3, 4));

        assertTrue(text.startsWith("LITERAL string aaa"));
        assertTrue(text.contains("..."));
        assertTrue(text.trim().endsWith("[3:4]"));
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", SourceTreeFormatter.format(null));
    }
}
