package com.pagepilot.util;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    @Test
    void numberReadsLooseInput() {
        assertEquals(12, Values.number(TextNode.valueOf(" 12 ")), 1e-9);
        assertEquals(0, Values.number(TextNode.valueOf("")), 1e-9);
        assertEquals(1, Values.number(BooleanNode.TRUE), 1e-9);
        assertEquals(4, Values.number(IntNode.valueOf(4)), 1e-9);
        assertTrue(Double.isNaN(Values.number(TextNode.valueOf("abc"))));
        assertTrue(Double.isNaN(Values.number(NullNode.getInstance())));
        assertTrue(Double.isNaN(Values.number(MissingNode.getInstance())));
    }

    @Test
    void clampFallsBackForNonFiniteValues() {
        assertEquals(5, Values.clamp(Double.NaN, 0, 10, 5), 1e-9);
        assertEquals(10, Values.clamp(99, 0, 10, 5), 1e-9);
        assertEquals(0, Values.clamp(-3, 0, 10, 5), 1e-9);
        assertEquals(5, Values.clamp(Double.POSITIVE_INFINITY, 0, 10, 5), 1e-9);
    }

    @Test
    void truncateAppendsEllipsis() {
        assertEquals("short", Values.truncate("short", 10));
        assertEquals("abc...", Values.truncate("abcdefgh", 4));
        assertEquals("", Values.truncate(null, 4));
    }

    @Test
    void safeUrlDropsQueryAndFragment() {
        assertEquals("https://example.com:8443/path", Values.safeUrl("https://example.com:8443/path?token=secret#top"));
        assertEquals("https://example.com/", Values.safeUrl("https://example.com?q=1"));
        assertEquals("(no-url)", Values.safeUrl(null));
        assertEquals("not a url", Values.safeUrl("not a url"));
    }

    @Test
    void textOnlyReturnsStrings() {
        assertEquals("hi", Values.text(TextNode.valueOf("hi")));
        assertNull(Values.text(IntNode.valueOf(1)));
        assertNull(Values.text(null));
    }
}
