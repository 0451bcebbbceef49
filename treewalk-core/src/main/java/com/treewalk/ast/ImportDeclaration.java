package com.treewalk.ast;

import java.util.List;

public record ImportDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Node> specifiers,
    Literal source,
    String importKind      // value or type
) implements Statement {
    public ImportDeclaration(SourceLocation loc, List<Node> specifiers, Literal source, String importKind) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), specifiers, source, importKind);
    }

    @Override
    public String type() {
        return "ImportDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case SPECIFIERS -> ChildSlot.of(specifiers);
            case SOURCE -> ChildSlot.of(source);
            default -> ChildSlot.empty();
        };
    }
}
