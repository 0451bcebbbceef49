package com.treewalk.ast;

public record ExportDefaultDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Node declaration  // declaration or expression
) implements Statement {
    public ExportDefaultDeclaration(SourceLocation loc, Node declaration) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), declaration);
    }

    @Override
    public String type() {
        return "ExportDefaultDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case DECLARATION -> ChildSlot.of(declaration);
            default -> ChildSlot.empty();
        };
    }
}
