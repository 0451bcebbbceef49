package com.treewalk.ast;

public record SpreadElement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression argument
) implements Node {
    public SpreadElement(SourceLocation loc, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument);
    }

    @Override
    public String type() {
        return "SpreadElement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
