package com.treewalk.ast;

public record VariableDeclarator(
    int start,
    int end,
    int startLine,
    int endLine,
    Pattern id,
    Expression init,
    TSTypeAnnotation typeAnnotation
) implements Node {
    public VariableDeclarator(SourceLocation loc, Pattern id, Expression init, TSTypeAnnotation typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, init, typeAnnotation);
    }

    @Override
    public String type() {
        return "VariableDeclarator";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case INIT -> ChildSlot.of(init);
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            default -> ChildSlot.empty();
        };
    }
}
