package com.treewalk.ast;

public record CatchClause(
    int start,
    int end,
    int startLine,
    int endLine,
    Pattern param,       // null for optional catch binding
    BlockStatement body
) implements Node {
    public CatchClause(SourceLocation loc, Pattern param, BlockStatement body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), param, body);
    }

    @Override
    public String type() {
        return "CatchClause";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case PARAM -> ChildSlot.of(param);
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
