package com.treewalk.ast;

public record EmptyStatement(
    int start,
    int end,
    int startLine,
    int endLine
) implements Statement {
    public EmptyStatement(SourceLocation loc) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }

    @Override
    public String type() {
        return "EmptyStatement";
    }
}
