package com.treewalk.ast;

public record LabeledStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier label,
    Statement body
) implements Statement {
    public LabeledStatement(SourceLocation loc, Identifier label, Statement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), label, body);
    }

    @Override
    public String type() {
        return "LabeledStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case LABEL -> ChildSlot.of(label);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
