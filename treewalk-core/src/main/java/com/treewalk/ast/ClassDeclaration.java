package com.treewalk.ast;

import java.util.List;

public record ClassDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    Expression superClass,
    TSTypeParameterDeclaration typeParameters,
    List<TSInterfaceHeritage> implementsClause,
    List<Decorator> decorators,
    ClassBody body,
    boolean isAbstract
) implements Statement {
    public ClassDeclaration(SourceLocation loc, Identifier id, Expression superClass, TSTypeParameterDeclaration typeParameters, List<TSInterfaceHeritage> implementsClause, List<Decorator> decorators, ClassBody body, boolean isAbstract) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, superClass, typeParameters, implementsClause, decorators, body, isAbstract);
    }

    @Override
    public String type() {
        return "ClassDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case SUPER_CLASS -> ChildSlot.of(superClass);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            case IMPLEMENTS -> ChildSlot.of(implementsClause);
            case DECORATORS -> ChildSlot.of(decorators);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
