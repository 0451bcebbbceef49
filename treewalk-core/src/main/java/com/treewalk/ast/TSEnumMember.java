package com.treewalk.ast;

public record TSEnumMember(
    int start,
    int end,
    int startLine,
    int endLine,
    Node id,
    Expression initializer
) implements Node {
    public TSEnumMember(SourceLocation loc, Node id, Expression initializer) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, initializer);
    }

    @Override
    public String type() {
        return "TSEnumMember";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case INITIALIZER -> ChildSlot.of(initializer);
            default -> ChildSlot.empty();
        };
    }
}
