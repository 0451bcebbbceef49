package com.treewalk.ast;

public record JSXIdentifier(
    int start,
    int end,
    int startLine,
    int endLine,
    String name
) implements Node {
    public JSXIdentifier(SourceLocation loc, String name) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), name);
    }

    @Override
    public String type() {
        return "JSXIdentifier";
    }
}
