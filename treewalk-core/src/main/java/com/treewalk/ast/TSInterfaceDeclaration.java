package com.treewalk.ast;

import java.util.List;

public record TSInterfaceDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    TSTypeParameterDeclaration typeParameters,
    List<TSInterfaceHeritage> extendsClause,
    TSInterfaceBody body
) implements Statement {
    public TSInterfaceDeclaration(SourceLocation loc, Identifier id, TSTypeParameterDeclaration typeParameters, List<TSInterfaceHeritage> extendsClause, TSInterfaceBody body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, typeParameters, extendsClause, body);
    }

    @Override
    public String type() {
        return "TSInterfaceDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case TYPE_PARAMETERS -> ChildSlot.of(typeParameters);
            case EXTENDS -> ChildSlot.of(extendsClause);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
