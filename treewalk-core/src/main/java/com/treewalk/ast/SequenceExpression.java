package com.treewalk.ast;

import java.util.List;

public record SequenceExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Expression> expressions
) implements Expression {
    public SequenceExpression(SourceLocation loc, List<Expression> expressions) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), expressions);
    }

    @Override
    public String type() {
        return "SequenceExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case EXPRESSIONS -> ChildSlot.of(expressions);
            default -> ChildSlot.empty();
        };
    }
}
