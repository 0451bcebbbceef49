package com.treewalk.ast;

public record ForOfStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Node left,
    Expression right,
    Statement body,
    boolean await
) implements Statement {
    public ForOfStatement(SourceLocation loc, Node left, Expression right, Statement body, boolean await) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), left, right, body, await);
    }

    @Override
    public String type() {
        return "ForOfStatement";
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
