package com.treewalk.ast;

public record Literal(
    int start,
    int end,
    int startLine,
    int endLine,
    Object value,  // String, Double, Boolean, BigInteger or null
    String raw,
    RegExp regex,  // non-null for regular expression literals
    String bigint  // digits of a bigint literal, without the trailing n
) implements Expression {
    public Literal(SourceLocation loc, Object value, String raw) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), value, raw, null, null);
    }

    public Literal(SourceLocation loc, Object value, String raw, RegExp regex, String bigint) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), value, raw, regex, bigint);
    }

    @Override
    public String type() {
        return "Literal";
    }

    public record RegExp(String pattern, String flags) {
    }
}
