package com.treewalk.ast;

public record TSTypeAliasDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    TSTypeParameterDeclaration typeParameters,
    TSType typeAnnotation
) implements Statement {
    public TSTypeAliasDeclaration(SourceLocation loc, Identifier id, TSTypeParameterDeclaration typeParameters, TSType typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, typeParameters, typeAnnotation);
    }

    @Override
    public String type() {
        return "TSTypeAliasDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            default -> ChildSlot.empty();
        };
    }
}
