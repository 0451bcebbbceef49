package com.treewalk.ast;

public record AssignmentExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    String operator,
    Node left,
    Expression right
) implements Expression {
    public AssignmentExpression(SourceLocation loc, String operator, Node left, Expression right) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), operator, left, right);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
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
