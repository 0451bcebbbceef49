package com.treewalk.ast;

public record Super(
    int start,
    int end,
    int startLine,
    int endLine
) implements Expression {
    public Super(SourceLocation loc) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }

    @Override
    public String type() {
        return "Super";
    }
}
