package com.treewalk.ast;

public record AwaitExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument
) implements Expression {
    public AwaitExpression(SourceLocation loc, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument);
    }

    @Override
    public String type() {
        return "AwaitExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
