package com.treewalk.ast;

public record TSTypeAnnotation(
    int start,
    int end,
    int startLine,
    int endLine,
    TSType typeAnnotation
) implements Node {
    public TSTypeAnnotation(SourceLocation loc, TSType typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), typeAnnotation);
    }

    @Override
    public String type() {
        return "TSTypeAnnotation";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            default -> ChildSlot.empty();
        };
    }
}
