package com.treewalk.ast;

/**
 * Inclusive 1-indexed line range of a node.
 */
public record LineRange(int startLine, int endLine) {

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
