package com.treewalk.ast;

import java.util.List;

public record TSTypeParameterDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    List<TSTypeParameter> params
) implements Node {
    public TSTypeParameterDeclaration(SourceLocation loc, List<TSTypeParameter> params) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), params);
    }

    @Override
    public String type() {
        return "TSTypeParameterDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case PARAMS -> ChildSlot.of(params);
            default -> ChildSlot.empty();
        };
    }
}
