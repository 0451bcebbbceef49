package com.treewalk.ast;

public record JSXClosingElement(
    int start,
    int end,
    int startLine,
    int endLine,
    Node name
) implements Node {
    public JSXClosingElement(SourceLocation loc, Node name) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name);
    }

    @Override
    public String type() {
        return "JSXClosingElement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case NAME -> ChildSlot.of(name);
            default -> ChildSlot.empty();
        };
    }
}
