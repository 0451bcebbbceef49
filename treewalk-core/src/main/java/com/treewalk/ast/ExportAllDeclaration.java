package com.treewalk.ast;

public record ExportAllDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier exported, // null for export * from 'mod'
    Literal source
) implements Statement {
    public ExportAllDeclaration(SourceLocation loc, Identifier exported, Literal source) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), exported, source);
    }

    @Override
    public String type() {
        return "ExportAllDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case EXPORTED -> ChildSlot.of(exported);
            case SOURCE -> ChildSlot.of(source);
            default -> ChildSlot.empty();
        };
    }
}
