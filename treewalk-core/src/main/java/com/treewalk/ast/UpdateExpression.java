package com.treewalk.ast;

public record UpdateExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    String operator,
    boolean prefix,
    Expression argument
) implements Expression {
    public UpdateExpression(SourceLocation loc, String operator, boolean prefix, Expression argument) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), operator, prefix, argument);
    }

    @Override
    public String type() {
        return "UpdateExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ARGUMENT -> ChildSlot.of(argument);
            default -> ChildSlot.empty();
        };
    }
}
