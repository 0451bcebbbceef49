package com.treewalk.convert;

import com.treewalk.Comment;
import com.treewalk.ParseError;
import com.treewalk.Severity;
import com.treewalk.source.SourceText;
import com.treewalk.source.Span;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects parser diagnostics and comments straight from the syntax tree.
 */
public final class CstScanner {

    private CstScanner() {
    }

    /**
     * One diagnostic per {@code ERROR} node and per parser-inserted {@code MISSING} token,
     * in source order.
     */
    public static List<ParseError> diagnostics(TSNode root, SourceText source) {
        List<ParseError> errors = new ArrayList<>();
        if (Cst.isAbsent(root) || !root.hasError()) {
            return errors;
        }
        ArrayDeque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (node.isMissing()) {
                errors.add(new ParseError("Missing " + describe(node.getType()), span(node, source), Severity.ERROR));
                continue;
            }
            if ("ERROR".equals(node.getType())) {
                errors.add(new ParseError(unexpected(node, source), span(node, source), Severity.ERROR));
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (!Cst.isAbsent(child) && (child.hasError() || child.isMissing())) {
                    stack.push(child);
                }
            }
        }
        errors.sort(Comparator.comparingInt(e -> e.span().start()));
        return errors;
    }

    /**
     * Every comment node, with delimiters stripped from its text. HTML-like {@code <!--} and
     * {@code -->} comments are reported as line comments. Comment-like text inside
     * strings, templates and regular expressions is never a comment node.
     */
    public static List<Comment> comments(TSNode root, SourceText source) {
        List<Comment> comments = new ArrayList<>();
        if (Cst.isAbsent(root)) {
            return comments;
        }
        ArrayDeque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (Cst.isComment(node)) {
                String raw = source.textOf(node.getStartByte(), node.getEndByte());
                boolean block = raw.startsWith("/*");
                comments.add(new Comment(strip(raw, block), span(node, source), block));
                continue;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (!Cst.isAbsent(child)) {
                    stack.push(child);
                }
            }
        }
        comments.sort(Comparator.comparingInt(c -> c.span().start()));
        return comments;
    }

    static String strip(String raw, boolean block) {
        if (block) {
            int end = raw.endsWith("*/") && raw.length() >= 4 ? raw.length() - 2 : raw.length();
            return raw.substring(2, end);
        }
        if (raw.startsWith("//")) {
            return raw.substring(2);
        }
        if (raw.startsWith("<!--")) {
            return raw.substring(4);
        }
        return raw.startsWith("-->") ? raw.substring(3) : raw;
    }

    private static String unexpected(TSNode node, SourceText source) {
        String text = source.textOf(node.getStartByte(), node.getEndByte()).strip();
        if (text.isEmpty()) {
            return "Unexpected token";
        }
        int newline = text.indexOf('\n');
        String first = newline >= 0 ? text.substring(0, newline).strip() : text;
        if (first.length() > 40) {
            first = first.substring(0, 40) + "...";
        }
        return "Unexpected token '" + first + "'";
    }

    private static String describe(String type) {
        return type.chars().allMatch(ch -> Character.isLetterOrDigit(ch) || ch == '_')
            ? type
            : "'" + type + "'";
    }

    private static Span span(TSNode node, SourceText source) {
        int length = source.byteLength();
        int start = Math.max(0, Math.min(node.getStartByte(), length));
        int end = Math.max(start, Math.min(node.getEndByte(), length));
        return new Span(start, end);
    }
}
