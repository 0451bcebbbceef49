package com.treewalk.ast;

public record AssignmentPattern(
    int start,
    int end,
    int startLine,
    int endLine,
    Pattern left,
    Expression right
) implements Pattern {
    public AssignmentPattern(SourceLocation loc, Pattern left, Expression right) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), left, right);
    }

    @Override
    public String type() {
        return "AssignmentPattern";
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
