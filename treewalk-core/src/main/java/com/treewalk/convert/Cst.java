package com.treewalk.convert;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe helpers over tree-sitter nodes.
 */
final class Cst {

    private Cst() {
    }

    static boolean isAbsent(TSNode node) {
        return node == null || node.isNull();
    }

    static boolean isComment(TSNode node) {
        String type = node.getType();
        return "comment".equals(type) || "html_comment".equals(type);
    }

    static TSNode field(TSNode node, String name) {
        if (isAbsent(node)) {
            return null;
        }
        TSNode child = node.getChildByFieldName(name);
        return isAbsent(child) ? null : child;
    }

    /**
     * Named children, skipping comments and parser-inserted missing nodes.
     */
    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        if (isAbsent(node)) {
            return result;
        }
        int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getNamedChild(i);
            if (!isAbsent(child) && !child.isMissing() && !isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    static TSNode firstNamed(TSNode node) {
        List<TSNode> named = namedChildren(node);
        return named.isEmpty() ? null : named.get(0);
    }

    static TSNode firstOfType(TSNode node, String... types) {
        for (TSNode child : namedChildren(node)) {
            String type = child.getType();
            for (String candidate : types) {
                if (candidate.equals(type)) {
                    return child;
                }
            }
        }
        return null;
    }

    /**
     * True if an anonymous token such as {@code "async"} or {@code "*"} is a direct child.
     */
    static boolean hasToken(TSNode node, String token) {
        if (isAbsent(node)) {
            return false;
        }
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (!isAbsent(child) && !child.isNamed() && !child.isMissing() && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Type of the first anonymous child, e.g. the keyword that opens a declaration.
     */
    static String firstToken(TSNode node) {
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (!isAbsent(child) && !child.isNamed()) {
                return child.getType();
            }
        }
        return null;
    }

    /**
     * Strips any number of parenthesized wrappers.
     */
    static TSNode unwrapParens(TSNode node) {
        TSNode current = node;
        while (!isAbsent(current) && "parenthesized_expression".equals(current.getType())) {
            TSNode inner = firstNamed(current);
            if (inner == null) {
                return current;
            }
            current = inner;
        }
        return current;
    }
}
