package com.treewalk.ast;

public record TryStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    BlockStatement block,
    CatchClause handler,
    BlockStatement finalizer
) implements Statement {
    public TryStatement(SourceLocation loc, BlockStatement block, CatchClause handler, BlockStatement finalizer) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), block, handler, finalizer);
    }

    @Override
    public String type() {
        return "TryStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BLOCK -> ChildSlot.of(block);
            case HANDLER -> ChildSlot.of(handler);
            case FINALIZER -> ChildSlot.of(finalizer);
            default -> ChildSlot.empty();
        };
    }
}
