package com.treewalk.source;

import java.nio.charset.StandardCharsets;

/**
 * Byte offset to line number table, built once per source buffer.
 *
 * <p>{@code lineAt(offset)} answers in constant time. Offsets are UTF-8 byte offsets; valid
 * offsets run from {@code 0} to {@code byteLength} inclusive, anything outside is clamped.
 * Lines are 1-indexed and increase by one after every {@code '\n'} (so a CRLF pair counts once).
 * The terminator byte itself belongs to the line it terminates.</p>
 */
public final class LineIndex {

    private final int[] lines;
    private final int totalLines;

    private LineIndex(int[] lines, int totalLines) {
        this.lines = lines;
        this.totalLines = totalLines;
    }

    public static LineIndex build(String source) {
        return build(source.getBytes(StandardCharsets.UTF_8));
    }

    public static LineIndex build(byte[] utf8) {
        int[] lines = new int[utf8.length + 1];
        int line = 1;
        for (int i = 0; i < utf8.length; i++) {
            lines[i] = line;
            if (utf8[i] == '\n') {
                line++;
            }
        }
        lines[utf8.length] = line;
        return new LineIndex(lines, line);
    }

    /**
     * Returns the 1-indexed line of a byte offset, clamping offsets outside {@code [0, byteLength]}.
     */
    public int lineAt(int offset) {
        if (offset <= 0) {
            return lines[0];
        }
        if (offset >= lines.length) {
            return lines[lines.length - 1];
        }
        return lines[offset];
    }

    public int totalLines() {
        return totalLines;
    }

    public int byteLength() {
        return lines.length - 1;
    }
}
