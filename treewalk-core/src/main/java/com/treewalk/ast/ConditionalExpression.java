package com.treewalk.ast;

public record ConditionalExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression test,
    Expression consequent,
    Expression alternate
) implements Expression {
    public ConditionalExpression(SourceLocation loc, Expression test, Expression consequent, Expression alternate) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), test, consequent, alternate);
    }

    @Override
    public String type() {
        return "ConditionalExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TEST -> ChildSlot.of(test);
            case CONSEQUENT -> ChildSlot.of(consequent);
            case ALTERNATE -> ChildSlot.of(alternate);
            default -> ChildSlot.empty();
        };
    }
}
