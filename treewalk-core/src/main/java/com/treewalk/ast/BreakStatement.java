package com.treewalk.ast;

public record BreakStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier label  // null when unlabeled
) implements Statement {
    public BreakStatement(SourceLocation loc, Identifier label) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), label);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LABEL -> ChildSlot.of(label);
            default -> ChildSlot.empty();
        };
    }
}
