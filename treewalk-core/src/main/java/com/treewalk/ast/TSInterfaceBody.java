package com.treewalk.ast;

import java.util.List;

public record TSInterfaceBody(
    int start,
    int end,
    int startLine,
    int endLine,
    List<TSSignature> body
) implements Node {
    public TSInterfaceBody(SourceLocation loc, List<TSSignature> body) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), body);
    }

    @Override
    public String type() {
        return "TSInterfaceBody";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case BODY -> ChildSlot.of(body);
            default -> ChildSlot.empty();
        };
    }
}
