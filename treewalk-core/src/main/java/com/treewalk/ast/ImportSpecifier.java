package com.treewalk.ast;

public record ImportSpecifier(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier imported,
    Identifier local
) implements Node {
    public ImportSpecifier(SourceLocation loc, Identifier imported, Identifier local) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), imported, local);
    }

    @Override
    public String type() {
        return "ImportSpecifier";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case IMPORTED -> ChildSlot.of(imported);
            case LOCAL -> ChildSlot.of(local);
            default -> ChildSlot.empty();
        };
    }
}
