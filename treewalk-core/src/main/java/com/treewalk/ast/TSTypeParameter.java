package com.treewalk.ast;

public record TSTypeParameter(
    int start,
    int end,
    int startLine,
    int endLine,
    String name,
    TSType constraint,
    TSType defaultType
) implements Node {
    public TSTypeParameter(SourceLocation loc, String name, TSType constraint, TSType defaultType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name, constraint, defaultType);
    }

    @Override
    public String type() {
        return "TSTypeParameter";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case CONSTRAINT -> ChildSlot.of(constraint);
            case DEFAULT -> ChildSlot.of(defaultType);
            default -> ChildSlot.empty();
        };
    }
}
