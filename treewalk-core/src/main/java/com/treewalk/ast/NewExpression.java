package com.treewalk.ast;

import java.util.List;

public record NewExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression callee,
    List<Node> arguments
) implements Expression {
    public NewExpression(SourceLocation loc, Expression callee, List<Node> arguments) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), callee, arguments);
    }

    @Override
    public String type() {
        return "NewExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case CALLEE -> ChildSlot.of(callee);
            case ARGUMENTS -> ChildSlot.of(arguments);
            default -> ChildSlot.empty();
        };
    }
}
