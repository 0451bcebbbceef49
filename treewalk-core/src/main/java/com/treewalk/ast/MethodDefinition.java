package com.treewalk.ast;

import java.util.List;

public record MethodDefinition(
    int start,
    int end,
    int startLine,
    int endLine,
    Node key,
    FunctionExpression value,
    String kind,                // constructor, method, get or set
    boolean computed,
    boolean isStatic,
    List<Decorator> decorators
) implements ClassMember {
    public MethodDefinition(SourceLocation loc, Node key, FunctionExpression value, String kind, boolean computed, boolean isStatic, List<Decorator> decorators) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), key, value, kind, computed, isStatic, decorators);
    }

    @Override
    public String type() {
        return "MethodDefinition";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case KEY -> ChildSlot.of(key);
            case VALUE -> ChildSlot.of(value);
            case DECORATORS -> ChildSlot.of(decorators);
            default -> ChildSlot.empty();
        };
    }
}
