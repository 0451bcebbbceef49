package com.treewalk.ast;

public record JSXSpreadAttribute(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument
) implements Node {
    public JSXSpreadAttribute(SourceLocation loc, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument);
    }

    @Override
    public String type() {
        return "JSXSpreadAttribute";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
