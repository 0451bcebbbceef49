package com.treewalk.ast;

import java.util.List;

public record TSIntersectionType(
    int start,
    int end,
    int startLine,
    int endLine,
    List<TSType> types
) implements TSType {
    public TSIntersectionType(SourceLocation loc, List<TSType> types) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), types);
    }

    @Override
    public String type() {
        return "TSIntersectionType";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TYPES -> ChildSlot.of(types);
            default -> ChildSlot.empty();
        };
    }
}
