package com.treewalk.ast;

import java.util.List;

public record JSXOpeningElement(
    int start,
    int end,
    int startLine,
    int endLine,
    Node name,
    List<Node> attributes,
    boolean selfClosing
) implements Node {
    public JSXOpeningElement(SourceLocation loc, Node name, List<Node> attributes, boolean selfClosing) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name, attributes, selfClosing);
    }

    @Override
    public String type() {
        return "JSXOpeningElement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case NAME -> ChildSlot.of(name);
            case ATTRIBUTES -> ChildSlot.of(attributes);
            default -> ChildSlot.empty();
        };
    }
}
