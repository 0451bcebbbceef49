package com.treewalk.ast;

public record ForStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Node init,         // VariableDeclaration or Expression
    Expression test,
    Expression update,
    Statement body
) implements Statement {
    public ForStatement(SourceLocation loc, Node init, Expression test, Expression update, Statement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), init, test, update, body);
    }

    @Override
    public String type() {
        return "ForStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case INIT -> ChildSlot.of(init);
            case TEST -> ChildSlot.of(test);
            case UPDATE -> ChildSlot.of(update);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
