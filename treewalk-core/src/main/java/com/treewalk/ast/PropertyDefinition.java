package com.treewalk.ast;

import java.util.List;

public record PropertyDefinition(
    int start,
    int end,
    int startLine,
    int endLine,
    Node key,
    Expression value,
    boolean computed,
    boolean isStatic,
    TSTypeAnnotation typeAnnotation,
    List<Decorator> decorators
) implements ClassMember {
    public PropertyDefinition(SourceLocation loc, Node key, Expression value, boolean computed, boolean isStatic, TSTypeAnnotation typeAnnotation, List<Decorator> decorators) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), key, value, computed, isStatic, typeAnnotation, decorators);
    }

    @Override
    public String type() {
        return "PropertyDefinition";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case KEY -> ChildSlot.of(key);
            case VALUE -> ChildSlot.of(value);
            case TYPE_ANNOTATION -> ChildSlot.of(typeAnnotation);
            case DECORATORS -> ChildSlot.of(decorators);
            default -> ChildSlot.empty();
        };
    }
}
