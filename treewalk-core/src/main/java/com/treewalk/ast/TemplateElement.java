package com.treewalk.ast;

public record TemplateElement(
    int start,
    int end,
    int startLine,
    int endLine,
    TemplateElementValue value,
    boolean tail
) implements Node {
    public TemplateElement(SourceLocation loc, TemplateElementValue value, boolean tail) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), value, tail);
    }

    @Override
    public String type() {
        return "TemplateElement";
    }

    public record TemplateElementValue(String raw, String cooked) {
    }
}
