package com.treewalk.ast;

public record MetaProperty(
    int start,
    int end,
    int startLine,
    int endLine,
    String meta,
    String property
) implements Expression {
    public MetaProperty(SourceLocation loc, String meta, String property) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), meta, property);
    }

    @Override
    public String type() {
        return "MetaProperty";
    }
}
