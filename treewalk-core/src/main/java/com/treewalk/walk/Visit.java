package com.treewalk.walk;

import com.treewalk.ast.Node;

/**
 * One walker step: a node and its distance from the walk root.
 */
public record Visit(Node node, int depth) {
}
