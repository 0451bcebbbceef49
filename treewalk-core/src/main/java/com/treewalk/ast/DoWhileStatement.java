package com.treewalk.ast;

public record DoWhileStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Statement body,
    Expression test
) implements Statement {
    public DoWhileStatement(SourceLocation loc, Statement body, Expression test) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), body, test);
    }

    @Override
    public String type() {
        return "DoWhileStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BODY -> ChildSlot.of(body);
            case TEST -> ChildSlot.of(test);
            default -> ChildSlot.empty();
        };
    }
}
