package com.treewalk.ast;

public record JSXSpreadChild(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression expression
) implements JSXChild {
    public JSXSpreadChild(SourceLocation loc, Expression expression) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), expression);
    }

    @Override
    public String type() {
        return "JSXSpreadChild";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case EXPRESSION -> ChildSlot.of(expression);
            default -> ChildSlot.empty();
        };
    }
}
