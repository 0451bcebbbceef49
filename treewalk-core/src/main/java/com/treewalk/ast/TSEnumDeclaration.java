package com.treewalk.ast;

import java.util.List;

public record TSEnumDeclaration(
    int start,
    int end,
    int startLine,
    int endLine,
    Identifier id,
    List<TSEnumMember> members,
    boolean isConst
) implements Statement {
    public TSEnumDeclaration(SourceLocation loc, Identifier id, List<TSEnumMember> members, boolean isConst) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), id, members, isConst);
    }

    @Override
    public String type() {
        return "TSEnumDeclaration";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case ID -> ChildSlot.of(id);
            case MEMBERS -> ChildSlot.of(members);
            default -> ChildSlot.empty();
        };
    }
}
