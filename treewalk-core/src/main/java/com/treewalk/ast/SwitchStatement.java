package com.treewalk.ast;

import java.util.List;

public record SwitchStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Expression discriminant,
    List<SwitchCase> cases
) implements Statement {
    public SwitchStatement(SourceLocation loc, Expression discriminant, List<SwitchCase> cases) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), discriminant, cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case DISCRIMINANT -> ChildSlot.of(discriminant);
            case CASES -> ChildSlot.of(cases);
            default -> ChildSlot.empty();
        };
    }
}
