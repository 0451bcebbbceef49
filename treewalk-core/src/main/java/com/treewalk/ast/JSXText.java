package com.treewalk.ast;

public record JSXText(
    int start,
    int end,
    int startLine,
    int endLine,
    String value,
    String raw
) implements JSXChild {
    public JSXText(SourceLocation loc, String value, String raw) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), value, raw);
    }

    @Override
    public String type() {
        return "JSXText";
    }
}
