package com.treewalk.ast;

import java.util.List;

public record Program(
    int start,
    int end,
    int startLine,
    int endLine,
    List<Statement> body,
    String sourceType
) implements Node {
    public Program(SourceLocation loc, List<Statement> body, String sourceType) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), body, sourceType);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
