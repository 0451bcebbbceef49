package com.treewalk.ast;

import com.treewalk.source.Span;

/**
 * Byte range plus the lines of both ends, as computed once by the converter.
 */
public record SourceLocation(int start, int end, int startLine, int endLine) {

    public Span span() {
        return new Span(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end + " (" + startLine + ":" + endLine + ")";
    }
}
