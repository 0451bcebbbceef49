package com.treewalk.ast;

public record JSXAttribute(
    int start,
    int end,
    int startLine,
    int endLine,
    Node name,
    Node value     // Literal, JSXExpressionContainer, JSXElement or null
) implements Node {
    public JSXAttribute(SourceLocation loc, Node name, Node value) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name, value);
    }

    @Override
    public String type() {
        return "JSXAttribute";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case NAME -> ChildSlot.of(name);
            case VALUE -> ChildSlot.of(value);
            default -> ChildSlot.empty();
        };
    }
}
