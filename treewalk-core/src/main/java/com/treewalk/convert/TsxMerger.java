package com.treewalk.convert;

import com.treewalk.Comment;
import com.treewalk.ParseError;
import com.treewalk.source.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Combines a TypeScript parse and a JSX parse of the same TSX source.
 *
 * <p>The top-level statements of both trees are cut into segments at the offsets where a
 * statement ends in both trees. Each segment is taken from the tree that reports fewer
 * syntax errors for it, the TypeScript tree on ties. A file whose type annotations and JSX
 * sit in different top-level statements therefore parses cleanly; a single statement that
 * needs both keeps the errors of its better parse.</p>
 */
public final class TsxMerger {
    private static final Logger log = LogManager.getLogger(TsxMerger.class);

    private TsxMerger() {
    }

    /**
     * Statements, diagnostics and comments chosen from the two trees, each in source order.
     */
    public record Merged(List<TSNode> statements, List<ParseError> errors, List<Comment> comments) {
    }

    public static Merged merge(TSNode typeScriptRoot, TSNode jsxRoot, SourceText source) {
        List<TSNode> typed = topLevel(typeScriptRoot);
        List<TSNode> jsx = topLevel(jsxRoot);

        Set<Integer> typedEnds = new HashSet<>();
        for (TSNode node : typed) {
            typedEnds.add(node.getEndByte());
        }
        TreeSet<Integer> cuts = new TreeSet<>();
        for (TSNode node : jsx) {
            if (typedEnds.contains(node.getEndByte())) {
                cuts.add(node.getEndByte());
            }
        }
        cuts.add(Integer.MAX_VALUE);

        List<Comment> typedComments = CstScanner.comments(typeScriptRoot, source);
        List<Comment> jsxComments = CstScanner.comments(jsxRoot, source);

        List<TSNode> statements = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        List<Comment> comments = new ArrayList<>();
        int i = 0;
        int j = 0;
        int segmentStart = 0;
        int fromJsx = 0;
        for (int cut : cuts) {
            List<TSNode> typedPart = new ArrayList<>();
            while (i < typed.size() && typed.get(i).getEndByte() <= cut) {
                typedPart.add(typed.get(i++));
            }
            List<TSNode> jsxPart = new ArrayList<>();
            while (j < jsx.size() && jsx.get(j).getEndByte() <= cut) {
                jsxPart.add(jsx.get(j++));
            }
            List<ParseError> typedErrors = diagnostics(typedPart, source);
            List<ParseError> jsxErrors = diagnostics(jsxPart, source);
            boolean useJsx = jsxErrors.size() < typedErrors.size();
            if (useJsx) {
                fromJsx++;
            }
            statements.addAll(useJsx ? jsxPart : typedPart);
            errors.addAll(useJsx ? jsxErrors : typedErrors);
            for (Comment comment : useJsx ? jsxComments : typedComments) {
                int start = comment.span().start();
                if (start >= segmentStart && start < cut) {
                    comments.add(comment);
                }
            }
            segmentStart = cut;
        }
        if (fromJsx > 0) {
            log.debug("Took {} of {} segments from the JSX parse", fromJsx, cuts.size());
        }
        errors.sort(Comparator.comparingInt(e -> e.span().start()));
        comments.sort(Comparator.comparingInt(c -> c.span().start()));
        return new Merged(List.copyOf(statements), List.copyOf(errors), List.copyOf(comments));
    }

    /**
     * Named top-level children except comments. Parser-inserted missing nodes are kept so their
     * diagnostics count against the segment.
     */
    private static List<TSNode> topLevel(TSNode root) {
        List<TSNode> result = new ArrayList<>();
        if (Cst.isAbsent(root)) {
            return result;
        }
        int count = root.getNamedChildCount();
        for (int k = 0; k < count; k++) {
            TSNode child = root.getNamedChild(k);
            if (!Cst.isAbsent(child) && !Cst.isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<ParseError> diagnostics(List<TSNode> nodes, SourceText source) {
        List<ParseError> errors = new ArrayList<>();
        for (TSNode node : nodes) {
            errors.addAll(CstScanner.diagnostics(node, source));
        }
        return errors;
    }
}
