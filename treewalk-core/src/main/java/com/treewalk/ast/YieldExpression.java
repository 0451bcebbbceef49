package com.treewalk.ast;

public record YieldExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument,
    boolean delegate
) implements Expression {
    public YieldExpression(SourceLocation loc, Expression argument, boolean delegate) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument, delegate);
    }

    @Override
    public String type() {
        return "YieldExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
