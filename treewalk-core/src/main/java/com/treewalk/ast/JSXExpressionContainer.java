package com.treewalk.ast;

public record JSXExpressionContainer(
    int start,
    int end,
    int startLine,
    int endLine,
    Node expression
) implements JSXChild {
    public JSXExpressionContainer(SourceLocation loc, Node expression) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), expression);
    }

    @Override
    public String type() {
        return "JSXExpressionContainer";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case EXPRESSION -> ChildSlot.of(expression);
            default -> ChildSlot.empty();
        };
    }
}
