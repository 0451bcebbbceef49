package com.treewalk.ast;

import java.util.List;

public record VariableDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    String kind,
    List<VariableDeclarator> declarations
) implements Statement {
    public VariableDeclaration(SourceLocation loc, String kind, List<VariableDeclarator> declarations) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), kind, declarations);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case DECLARATIONS -> ChildSlot.of(declarations);
            default -> ChildSlot.empty();
        };
    }
}
