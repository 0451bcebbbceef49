package com.treewalk.ast;

import java.util.List;

public record JSXFragment(
    int start,
    int end,
    int startLine,
    int endLine,
    List<JSXChild> children
) implements Expression, JSXChild {
    public JSXFragment(SourceLocation loc, List<JSXChild> children) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), children);
    }

    @Override
    public String type() {
        return "JSXFragment";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case CHILDREN -> ChildSlot.of(children);
            default -> ChildSlot.empty();
        };
    }
}
