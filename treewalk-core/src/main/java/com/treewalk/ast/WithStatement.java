package com.treewalk.ast;

public record WithStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression object, // always a generic node
    Statement body
) implements Statement {
    public WithStatement(SourceLocation loc, Expression object, Statement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), object, body);
    }

    @Override
    public String type() {
        return "WithStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case OBJECT -> ChildSlot.of(object);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
