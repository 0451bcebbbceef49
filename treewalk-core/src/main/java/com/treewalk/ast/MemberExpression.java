package com.treewalk.ast;

public record MemberExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression object,
    Node property,
    boolean computed,
    boolean optional
) implements Expression, Pattern {
    public MemberExpression(SourceLocation loc, Expression object, Node property, boolean computed, boolean optional) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), object, property, computed, optional);
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case OBJECT -> ChildSlot.of(object);
            case PROPERTY -> ChildSlot.of(property);
            default -> ChildSlot.empty();
        };
    }
}
