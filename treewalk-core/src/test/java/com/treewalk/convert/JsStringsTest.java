package com.treewalk.convert;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class JsStringsTest {

    @Test
    void testCookStringStripsQuotes() {
        assertEquals("abc", JsStrings.cookString("'abc'"));
        assertEquals("abc", JsStrings.cookString("\"abc\""));
        assertEquals("", JsStrings.cookString("''"));
        assertEquals("it's", JsStrings.cookString("'it\\'s'"));
    }

    @Test
    void testEscapes() {
        assertEquals("a\tb\nc", JsStrings.unescape("a\\tb\\nc"));
        assertEquals("A", JsStrings.unescape("\\x41"));
        assertEquals("é", JsStrings.unescape("\\u00e9"));
        assertEquals("😀", JsStrings.unescape("\\u{1F600}"));
        assertEquals("\\", JsStrings.unescape("\\\\"));
        assertEquals("ab", JsStrings.unescape("a\\\nb"), "line continuation");
        assertEquals("ab", JsStrings.unescape("a\\\r\nb"));
    }

    @Test
    void testMalformedEscapesKeepCharacter() {
        assertEquals("xZZ", JsStrings.unescape("\\xZZ"));
        assertEquals("u12", JsStrings.unescape("\\u12"));
        assertEquals("q", JsStrings.unescape("\\q"));
        assertEquals("trailing\\", JsStrings.unescape("trailing\\"));
    }

    @Test
    void testNumbers() {
        assertEquals(42.0, JsStrings.parseNumber("42"));
        assertEquals(255.0, JsStrings.parseNumber("0xFF"));
        assertEquals(8.0, JsStrings.parseNumber("0o10"));
        assertEquals(5.0, JsStrings.parseNumber("0b101"));
        assertEquals(8.0, JsStrings.parseNumber("010"), "legacy octal");
        assertEquals(9.0, JsStrings.parseNumber("09"));
        assertEquals(1500.0, JsStrings.parseNumber("1.5e3"));
        assertEquals(1000.0, JsStrings.parseNumber("1_000"));
        assertEquals(0.0, JsStrings.parseNumber("0"));
    }

    @Test
    void testBigInts() {
        assertEquals(BigInteger.valueOf(10), JsStrings.parseBigInt("10n"));
        assertEquals(BigInteger.valueOf(255), JsStrings.parseBigInt("0xffn"));
        assertEquals(new BigInteger("9007199254740993"), JsStrings.parseBigInt("9007199254740993n"));
    }

    @Test
    void testCommentDelimitersStripped() {
        assertEquals(" note", CstScanner.strip("// note", false));
        assertEquals(" a\n b ", CstScanner.strip("/* a\n b */", true));
        assertEquals("", CstScanner.strip("/**/", true));
        assertEquals(" open", CstScanner.strip("/* open", true));
        assertEquals(" legacy", CstScanner.strip("<!-- legacy", false));
        assertEquals(" end", CstScanner.strip("--> end", false));
    }
}
