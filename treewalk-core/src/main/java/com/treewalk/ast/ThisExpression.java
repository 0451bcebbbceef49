package com.treewalk.ast;

public record ThisExpression(
    int start,
    int end,
    int startLine,
    int endLine
) implements Expression {
    public ThisExpression(SourceLocation loc) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }

    @Override
    public String type() {
        return "ThisExpression";
    }
}
