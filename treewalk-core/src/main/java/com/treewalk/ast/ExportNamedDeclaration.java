package com.treewalk.ast;

import java.util.List;

public record ExportNamedDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Statement declaration,
    List<ExportSpecifier> specifiers,
    Literal source
) implements Statement {
    public ExportNamedDeclaration(SourceLocation loc, Statement declaration, List<ExportSpecifier> specifiers, Literal source) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), declaration, specifiers, source);
    }

    @Override
    public String type() {
        return "ExportNamedDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case DECLARATION -> ChildSlot.of(declaration);
            case SPECIFIERS -> ChildSlot.of(specifiers);
            case SOURCE -> ChildSlot.of(source);
            default -> ChildSlot.empty();
        };
    }
}
