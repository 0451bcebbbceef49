package com.treewalk.ast;

public record TSArrayType(
    int start,
    int end,
    int startLine,
    int endLine,
    TSType elementType
) implements TSType {
    public TSArrayType(SourceLocation loc, TSType elementType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), elementType);
    }

    @Override
    public String type() {
        return "TSArrayType";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ELEMENT_TYPE -> ChildSlot.of(elementType);
            default -> ChildSlot.empty();
        };
    }
}
