package com.treewalk;

import com.treewalk.source.Span;

/**
 * A diagnostic reported by the parser.
 */
public record ParseError(String message, Span span, Severity severity) {

    public ParseError(String message, Span span) {
        this(message, span, Severity.ERROR);
    }

    @Override
    public String toString() {
        return severity + " " + message + " at " + span;
    }
}
