package com.treewalk.ast;

public record RestElement(
    int start,
    int end,
    int startLine,
    int endLine,
    Pattern argument,
    TSTypeAnnotation typeAnnotation
) implements Pattern {
    public RestElement(SourceLocation loc, Pattern argument, TSTypeAnnotation typeAnnotation) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), argument, typeAnnotation);
    }

    @Override
    public String type() {
        return "RestElement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            default -> ChildSlot.empty();
        };
    }
}
