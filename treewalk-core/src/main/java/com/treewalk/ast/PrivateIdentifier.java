package com.treewalk.ast;

public record PrivateIdentifier(
    int start,
    int end,
    int startLine,
    int endLine,
    String name
) implements Expression {
    public PrivateIdentifier(SourceLocation loc, String name) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name);
    }

    @Override
    public String type() {
        return "PrivateIdentifier";
    }
}
