package com.treewalk.ast;

import java.util.List;

public record CallExpression(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression callee,
    List<Node> arguments,
    boolean optional
) implements Expression {
    public CallExpression(SourceLocation loc, Expression callee, List<Node> arguments, boolean optional) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), callee, arguments, optional);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case CALLEE -> ChildSlot.of(callee);
            case ARGUMENTS -> ChildSlot.of(arguments);
            default -> ChildSlot.empty();
        };
    }
}
