package com.treewalk.ast;

public record ThrowStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument
) implements Statement {
    public ThrowStatement(SourceLocation loc, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument);
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
