package com.treewalk.walk;

public enum TraversalOrder {
    /** Depth-first: a node is followed by its whole subtree before its next sibling. */
    PRE_ORDER,
    /** Breadth-first: every node at depth {@code d} is visited before any node at {@code d + 1}. */
    LEVEL_ORDER
}
