package com.treewalk.ast;

import java.util.List;

public record SwitchCase(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression test,            // null for default case
    List<Statement> consequent
) implements Node {
    public SwitchCase(SourceLocation loc, Expression test, List<Statement> consequent) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), test, consequent);
    }

    @Override
    public String type() {
        return "SwitchCase";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case TEST -> ChildSlot.of(test);
            case CONSEQUENT -> ChildSlot.of(consequent);
            default -> ChildSlot.empty();
        };
    }
}
