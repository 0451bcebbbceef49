package com.treewalk.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    boolean async,
    boolean generator,
    List<Pattern> params,
    BlockStatement body,                       // null for overload signatures
    TSTypeParameterDeclaration typeParameters,
    TSTypeAnnotation returnType
) implements Statement {
    public FunctionDeclaration(SourceLocation loc, Identifier id, boolean async, boolean generator, List<Pattern> params, BlockStatement body, TSTypeParameterDeclaration typeParameters, TSTypeAnnotation returnType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, async, generator, params, body, typeParameters, returnType);
    }

    @Override
    public String type() {
        return "FunctionDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case PARAMS -> ChildSlot.of(params);
            case BODY -> ChildSlot.of(body);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            case RETURN_TYPE -> ChildSlot.of(returnType);
            default -> ChildSlot.empty();
        };
    }
}
