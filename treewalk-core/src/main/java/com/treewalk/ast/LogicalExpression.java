package com.treewalk.ast;

public record LogicalExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    public LogicalExpression(SourceLocation loc, String operator, Expression left, Expression right) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), operator, left, right);
    }

    @Override
    public String type() {
        return "LogicalExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LEFT -> ChildSlot.of(left);
            case RIGHT -> ChildSlot.of(right);
            default -> ChildSlot.empty();
        };
    }
}
