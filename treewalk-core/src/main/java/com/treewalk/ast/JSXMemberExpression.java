package com.treewalk.ast;

public record JSXMemberExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Node object,
    JSXIdentifier property
) implements Node {
    public JSXMemberExpression(SourceLocation loc, Node object, JSXIdentifier property) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), object, property);
    }

    @Override
    public String type() {
        return "JSXMemberExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case OBJECT -> ChildSlot.of(object);
            case PROPERTY -> ChildSlot.of(property);
            default -> ChildSlot.empty();
        };
    }
}
