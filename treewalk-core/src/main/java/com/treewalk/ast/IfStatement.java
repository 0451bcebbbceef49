package com.treewalk.ast;

public record IfStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression test,
    Statement consequent,
    Statement alternate   // null without else
) implements Statement {
    public IfStatement(SourceLocation loc, Expression test, Statement consequent, Statement alternate) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), test, consequent, alternate);
    }

    @Override
    public String type() {
        return "IfStatement";
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
