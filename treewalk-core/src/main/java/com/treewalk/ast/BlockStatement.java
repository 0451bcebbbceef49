package com.treewalk.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Statement> body
) implements Statement {
    public BlockStatement(SourceLocation loc, List<Statement> body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), body);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
