package com.treewalk.ast;

public record ClassExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    Expression superClass,
    ClassBody body
) implements Expression {
    public ClassExpression(SourceLocation loc, Identifier id, Expression superClass, ClassBody body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, superClass, body);
    }

    @Override
    public String type() {
        return "ClassExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case SUPER_CLASS -> ChildSlot.of(superClass);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
