package com.treewalk.ast;

public record TSInterfaceHeritage(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression expression,
    TSTypeParameterInstantiation typeParameters
) implements Node {
    public TSInterfaceHeritage(SourceLocation loc, Expression expression, TSTypeParameterInstantiation typeParameters) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), expression, typeParameters);
    }

    @Override
    public String type() {
        return "TSInterfaceHeritage";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case EXPRESSION -> ChildSlot.of(expression);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            default -> ChildSlot.empty();
        };
    }
}
