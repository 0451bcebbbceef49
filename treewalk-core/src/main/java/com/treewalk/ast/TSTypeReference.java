package com.treewalk.ast;

public record TSTypeReference(
    int start,
    int end,
    int startLine,
    int endLine,
    Node typeName,
    TSTypeParameterInstantiation typeParameters
) implements TSType {
    public TSTypeReference(SourceLocation loc, Node typeName, TSTypeParameterInstantiation typeParameters) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), typeName, typeParameters);
    }

    @Override
    public String type() {
        return "TSTypeReference";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TYPE_NAME -> ChildSlot.of(typeName);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            default -> ChildSlot.empty();
        };
    }
}
