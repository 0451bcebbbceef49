package com.treewalk.ast;

public record ForInStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Node left,
    Expression right,
    Statement body
) implements Statement {
    public ForInStatement(SourceLocation loc, Node left, Expression right, Statement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), left, right, body);
    }

    @Override
    public String type() {
        return "ForInStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LEFT -> ChildSlot.of(left);
            case RIGHT -> ChildSlot.of(right);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
