package com.treewalk.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceTextTest {

    @Test
    void testTextOfSpan() {
        SourceText source = SourceText.of("const x = 1;");
        assertEquals("const", source.textOf(new Span(0, 5)));
        assertEquals("x", source.textOf(6, 7));
        assertEquals("const x = 1;", source.textOf(source.fullSpan()));
    }

    @Test
    void testTextOfClampsOutOfRange() {
        SourceText source = SourceText.of("abc");
        assertEquals("abc", source.textOf(-10, 100));
        assertEquals("bc", source.textOf(1, 50));
        assertEquals("", source.textOf(5, 9));
    }

    @Test
    void testMalformedSpanYieldsEmpty() {
        SourceText source = SourceText.of("abcdef");
        assertEquals("", source.textOf(4, 2));
        assertEquals("", source.textOf(3, 3));
    }

    @Test
    void testByteOffsetsWithMultiByteText() {
        SourceText source = SourceText.of("const s = 'héllo';");
        // é takes two bytes
        assertEquals(19, source.byteLength());
        assertEquals("'héllo'", source.textOf(10, 18));
        assertEquals(18, source.byteOffset(17));
        assertEquals(17, source.charOffset(18));
    }

    @Test
    void testCharAndByteOffsetsRoundTripOnAscii() {
        SourceText source = SourceText.of("let a = 1;\nlet b = 2;");
        for (int i = 0; i <= source.text().length(); i++) {
            assertEquals(i, source.charOffset(source.byteOffset(i)));
        }
    }

    @Test
    void testSliceMatchesTextOf() {
        String text = "a\nüb\nc";
        SourceText source = SourceText.of(text);
        assertEquals(source.textOf(2, 5), SourceText.slice(text, 2, 5));
        assertEquals("", SourceText.slice(text, 5, 2));
    }

    @Test
    void testLines() {
        SourceText source = SourceText.of("a\nb\n");
        assertEquals(3, source.totalLines());
        assertEquals(2, source.lineAt(2));
    }

    @Test
    void testNullRejected() {
        assertThrows(NullPointerException.class, () -> SourceText.of(null));
    }

    @Test
    void testSpanValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4));
        Span span = new Span(2, 6);
        assertEquals(4, span.length());
        assertTrue(span.contains(new Span(3, 6)));
        assertFalse(span.overlaps(new Span(6, 8)));
        assertTrue(new Span(3, 3).isEmpty());
    }
}
