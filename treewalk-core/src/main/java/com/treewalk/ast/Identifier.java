package com.treewalk.ast;

public record Identifier(
    int start,
    int end,
    int startLine,
    int endLine,
    String name,
    TSTypeAnnotation typeAnnotation  // parameter annotations in TypeScript, otherwise null
) implements Expression, Pattern {
    public Identifier(SourceLocation loc, String name, TSTypeAnnotation typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name, typeAnnotation);
    }

    public Identifier(SourceLocation loc, String name) {
        this(loc, name, null);
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return role == ChildRole.TYPE_ANNOTATION ? ChildSlot.of(typeAnnotation) : ChildSlot.empty();
    }
}
