package com.treewalk.ast;

import java.util.List;

public record ClassBody(
    int start,
    int end,
    int startLine,
    int endLine,
    List<ClassMember> body
) implements Node {
    public ClassBody(SourceLocation loc, List<ClassMember> body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), body);
    }

    @Override
    public String type() {
        return "ClassBody";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
