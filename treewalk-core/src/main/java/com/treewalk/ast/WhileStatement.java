package com.treewalk.ast;

public record WhileStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression test,
    Statement body
) implements Statement {
    public WhileStatement(SourceLocation loc, Expression test, Statement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), test, body);
    }

    @Override
    public String type() {
        return "WhileStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TEST -> ChildSlot.of(test);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
