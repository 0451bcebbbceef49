package com.treewalk.source;

/**
 * Half-open range {@code [start, end)} of UTF-8 byte offsets into a source buffer.
 * Empty spans ({@code start == end}) are allowed.
 */
public record Span(int start, int end) {

    public static final Span EMPTY = new Span(0, 0);

    public Span {
        if (start < 0) {
            throw new IllegalArgumentException("span start must be >= 0, got " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("span end " + end + " precedes start " + start);
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
