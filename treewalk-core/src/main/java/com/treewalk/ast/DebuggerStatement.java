package com.treewalk.ast;

public record DebuggerStatement(
    int start,
    int end,
    int startLine,
    int endLine
) implements Statement {
    public DebuggerStatement(SourceLocation loc) {
        this(loc.start(), loc.end(), loc.startLine(), loc.endLine());
    }

    @Override
    public String type() {
        return "DebuggerStatement";
    }
}
