package com.treewalk.ast;

import java.util.List;

public record ArrayExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Node> elements  // holes are dropped
) implements Expression {
    public ArrayExpression(SourceLocation loc, List<Node> elements) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), elements);
    }

    @Override
    public String type() {
        return "ArrayExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ELEMENTS -> ChildSlot.of(elements);
            default -> ChildSlot.empty();
        };
    }
}
