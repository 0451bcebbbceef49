package com.treewalk.ast;

public record Property(
    int start,
    int end,
    int startLine,
    int endLine,
    Node key,
    Node value,
    String kind,
    boolean method,
    boolean shorthand,
    boolean computed
) implements Node {
    public Property(SourceLocation loc, Node key, Node value, String kind, boolean method, boolean shorthand, boolean computed) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine(), key, value, kind, method, shorthand, computed);
    }

    @Override
    public String type() {
        return "Property";
    }

    @Override
    public ChildSlot slot(ChildRole role) {
        return switch (role) {
            case KEY -> ChildSlot.of(key);
            case VALUE -> ChildSlot.of(value);
            default -> ChildSlot.empty();
        };
    }
}
