package com.treewalk.ast;

public record ImportNamespaceSpecifier(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier local
) implements Node {
    public ImportNamespaceSpecifier(SourceLocation loc, Identifier local) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), local);
    }

    @Override
    public String type() {
        return "ImportNamespaceSpecifier";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LOCAL -> ChildSlot.of(local);
            default -> ChildSlot.empty();
        };
    }
}
