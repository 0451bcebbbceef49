package com.treewalk;

import com.treewalk.source.Span;

/**
 * A source comment. {@code text} has its {@code //} or {@code /* *}{@code /} delimiters removed;
 * {@code span} covers the full comment including delimiters.
 */
public record Comment(String text, Span span, boolean block) {

    public boolean isLine() {
        return !block;
    }
}
