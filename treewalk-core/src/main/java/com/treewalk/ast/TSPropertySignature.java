package com.treewalk.ast;

public record TSPropertySignature(
    int start,
    int end,
    int startLine,
    int endLine,
    Node key,
    boolean computed,
    boolean optional,
    boolean readonly,
    TSTypeAnnotation typeAnnotation
) implements TSSignature {
    public TSPropertySignature(SourceLocation loc, Node key, boolean computed, boolean optional, boolean readonly, TSTypeAnnotation typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), key, computed, optional, readonly, typeAnnotation);
    }

    @Override
    public String type() {
        return "TSPropertySignature";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case KEY -> ChildSlot.of(key);
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            default -> ChildSlot.empty();
        };
    }
}
