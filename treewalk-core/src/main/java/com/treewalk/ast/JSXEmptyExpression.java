package com.treewalk.ast;

public record JSXEmptyExpression(
    int start,
    int end,
    int startLine,
    int endLine
) implements Node {
    public JSXEmptyExpression(SourceLocation loc) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }

    @Override
    public String type() {
        return "JSXEmptyExpression";
    }
}
