package com.treewalk.ast;

import java.util.List;

public record TSTypeParameterInstantiation(
    int start,
    int end,
    int startLine,
    int endLine,
    List<TSType> params
) implements Node {
    public TSTypeParameterInstantiation(SourceLocation loc, List<TSType> params) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), params);
    }

    @Override
    public String type() {
        return "TSTypeParameterInstantiation";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case PARAMS -> ChildSlot.of(params);
            default -> ChildSlot.empty();
        };
    }
}
