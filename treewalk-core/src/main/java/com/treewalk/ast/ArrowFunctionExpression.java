package com.treewalk.ast;

import java.util.List;

public record ArrowFunctionExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    boolean async,
    boolean expression,                        // true if body is an expression, false if a block
    List<Pattern> params,
    Node body,
    TSTypeParameterDeclaration typeParameters,
    TSTypeAnnotation returnType
) implements Expression {
    public ArrowFunctionExpression(SourceLocation loc, boolean async, boolean expression, List<Pattern> params, Node body, TSTypeParameterDeclaration typeParameters, TSTypeAnnotation returnType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), async, expression, params, body, typeParameters, returnType);
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case PARAMS -> ChildSlot.of(params);
            case BODY -> ChildSlot.of(body);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            case RETURN_TYPE -> ChildSlot.of(returnType);
            default -> ChildSlot.empty();
        };
    }
}
