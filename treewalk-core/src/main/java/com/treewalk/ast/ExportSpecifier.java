package com.treewalk.ast;

public record ExportSpecifier(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier local,
    Identifier exported
) implements Node {
    public ExportSpecifier(SourceLocation loc, Identifier local, Identifier exported) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), local, exported);
    }

    @Override
    public String type() {
        return "ExportSpecifier";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LOCAL -> ChildSlot.of(local);
            case EXPORTED -> ChildSlot.of(exported);
            default -> ChildSlot.empty();
        };
    }
}
