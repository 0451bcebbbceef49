package com.treewalk.ast;

public record ContinueStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier label
) implements Statement {
    public ContinueStatement(SourceLocation loc, Identifier label) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), label);
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LABEL -> ChildSlot.of(label);
            default -> ChildSlot.empty();
        };
    }
}
