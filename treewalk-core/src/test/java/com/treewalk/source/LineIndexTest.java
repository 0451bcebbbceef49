package com.treewalk.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class LineIndexTest {

    @Test
    void testSingleLine() {
        LineIndex index = LineIndex.build("const x = 1;");
        assertEquals(1, index.totalLines());
        assertEquals(1, index.lineAt(0));
        assertEquals(1, index.lineAt(12));
        assertEquals(12, index.byteLength());
    }

    @Test
    void testEmptySource() {
        LineIndex index = LineIndex.build("");
        assertEquals(1, index.totalLines());
        assertEquals(1, index.lineAt(0));
        assertEquals(0, index.byteLength());
    }

    @Test
    void testTerminatorBelongsToLineItEnds() {
        LineIndex index = LineIndex.build("a\nb\nc");
        assertEquals(1, index.lineAt(0));
        assertEquals(1, index.lineAt(1), "the newline byte is still on line 1");
        assertEquals(2, index.lineAt(2));
        assertEquals(2, index.lineAt(3));
        assertEquals(3, index.lineAt(4));
        assertEquals(3, index.totalLines());
    }

    @Test
    void testTrailingNewlineStartsAnotherLine() {
        LineIndex index = LineIndex.build("a\n");
        assertEquals(2, index.totalLines());
        assertEquals(1, index.lineAt(1));
        assertEquals(2, index.lineAt(2));
    }

    @Test
    @DisplayName("CRLF counts as a single line break")
    void testCrlf() {
        LineIndex index = LineIndex.build("a\r\nb\r\nc");
        assertEquals(3, index.totalLines());
        assertEquals(1, index.lineAt(1), "\\r stays on line 1");
        assertEquals(1, index.lineAt(2), "\\n stays on line 1");
        assertEquals(2, index.lineAt(3));
        assertEquals(3, index.lineAt(6));
    }

    @Test
    @DisplayName("Multi-byte characters do not shift line numbers")
    void testMultiByte() {
        String source = "é\n😀\nz";
        byte[] utf8 = source.getBytes(StandardCharsets.UTF_8);
        LineIndex index = LineIndex.build(utf8);
        assertEquals(3, index.totalLines());
        int zOffset = utf8.length - 1;
        assertEquals(3, index.lineAt(zOffset));
        // é is two bytes, so its newline sits at byte 2
        assertEquals(1, index.lineAt(2));
        assertEquals(2, index.lineAt(3));
    }

    @Test
    void testOutOfRangeOffsetsClamp() {
        LineIndex index = LineIndex.build("a\nb");
        assertEquals(1, index.lineAt(-5));
        assertEquals(2, index.lineAt(999));
        assertEquals(2, index.lineAt(Integer.MAX_VALUE));
    }

    @Test
    void testRebuildGivesSameAnswers() {
        String source = "function f() {\n  return 1;\n}\n";
        LineIndex first = LineIndex.build(source);
        LineIndex second = LineIndex.build(source);
        for (int offset = -1; offset <= source.length() + 1; offset++) {
            assertEquals(first.lineAt(offset), second.lineAt(offset), "offset " + offset);
        }
        assertEquals(first.totalLines(), second.totalLines());
    }

    @Test
    void testMonotonic() {
        LineIndex index = LineIndex.build("a\n\n\nb\nccc\n");
        int previous = index.lineAt(0);
        for (int offset = 1; offset <= index.byteLength(); offset++) {
            int line = index.lineAt(offset);
            assertTrue(line == previous || line == previous + 1, "offset " + offset);
            previous = line;
        }
    }
}
