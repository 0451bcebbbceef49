package com.treewalk.ast;

import java.util.List;

public record ObjectExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Node> properties
) implements Expression {
    public ObjectExpression(SourceLocation loc, List<Node> properties) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case PROPERTIES -> ChildSlot.of(properties);
            default -> ChildSlot.empty();
        };
    }
}
