package com.treewalk.ast;

public record ReturnStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument  // null for a bare return
) implements Statement {
    public ReturnStatement(SourceLocation loc, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
