package com.treewalk.source;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Read-only source buffer: the original text, its UTF-8 bytes and the line index built over them.
 *
 * <p>All offsets are UTF-8 byte offsets. Extraction never fails: out-of-range spans are clamped
 * to {@code [0, byteLength]} and a span whose start lies past its end yields the empty string.</p>
 */
public final class SourceText {
    private static final Logger log = LogManager.getLogger(SourceText.class);

    private final String text;
    private final byte[] utf8;
    private final LineIndex lineIndex;

    private SourceText(String text, byte[] utf8) {
        this.text = text;
        this.utf8 = utf8;
        this.lineIndex = LineIndex.build(utf8);
    }

    public static SourceText of(String text) {
        Objects.requireNonNull(text, "text");
        return new SourceText(text, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts a byte span from a plain string without building a line index.
     */
    public static String slice(String source, int startByte, int endByte) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        int start = Math.max(0, Math.min(startByte, bytes.length));
        int end = Math.max(0, Math.min(endByte, bytes.length));
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8;
    }

    public int byteLength() {
        return utf8.length;
    }

    public LineIndex lineIndex() {
        return lineIndex;
    }

    public int totalLines() {
        return lineIndex.totalLines();
    }

    public int lineAt(int byteOffset) {
        return lineIndex.lineAt(byteOffset);
    }

    public Span fullSpan() {
        return new Span(0, utf8.length);
    }

    public String textOf(Span span) {
        return textOf(span.start(), span.end());
    }

    /**
     * Extracts {@code [startByte, endByte)} after clamping both ends to the buffer.
     */
    public String textOf(int startByte, int endByte) {
        int start = clamp(startByte);
        int end = clamp(endByte);
        if (start != startByte || end != endByte) {
            log.warn("Span {}..{} outside source of {} bytes, clamped to {}..{}",
                startByte, endByte, utf8.length, start, end);
        }
        if (end <= start) {
            return "";
        }
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Converts a byte offset into a Java {@code String} index (UTF-16 code units).
     */
    public int charOffset(int byteOffset) {
        int clamped = clamp(byteOffset);
        if (clamped == 0) {
            return 0;
        }
        if (clamped == utf8.length) {
            return text.length();
        }
        return new String(utf8, 0, clamped, StandardCharsets.UTF_8).length();
    }

    /**
     * Converts a Java {@code String} index into a UTF-8 byte offset.
     */
    public int byteOffset(int charOffset) {
        if (charOffset <= 0) {
            return 0;
        }
        if (charOffset >= text.length()) {
            return utf8.length;
        }
        return text.substring(0, charOffset).getBytes(StandardCharsets.UTF_8).length;
    }

    private int clamp(int offset) {
        return Math.max(0, Math.min(offset, utf8.length));
    }

    @Override
    public String toString() {
        return "SourceText[bytes=" + utf8.length + ", lines=" + lineIndex.totalLines() + "]";
    }
}
