package com.treewalk.ast;

public record ImportExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression source
) implements Expression {
    public ImportExpression(SourceLocation loc, Expression source) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), source);
    }

    @Override
    public String type() {
        return "ImportExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case SOURCE -> ChildSlot.of(source);
            default -> ChildSlot.empty();
        };
    }
}
