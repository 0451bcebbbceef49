package com.treewalk.convert;

import com.treewalk.SourceType;
import com.treewalk.ast.GenericNode;
import com.treewalk.ast.SourceLocation;
import com.treewalk.source.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * State shared by the converter families during one conversion: the source buffer with its
 * line index, the source type and the families themselves.
 */
public final class ConversionContext {
    private static final Logger log = LogManager.getLogger(ConversionContext.class);

    /**
     * Nesting depth past which expressions and statements are kept as generic nodes.
     */
    static final int MAX_DEPTH = 500;

    private final SourceText source;
    private final SourceType sourceType;
    private final StatementConverter statements;
    private final ExpressionConverter expressions;
    private final PatternConverter patterns;
    private final JsxConverter jsx;
    private final TypeScriptConverter types;
    private int swallowed;
    private int depth;
    private boolean truncated;

    public ConversionContext(SourceText source, SourceType sourceType) {
        this.source = source;
        this.sourceType = sourceType;
        this.statements = new StatementConverter(this);
        this.expressions = new ExpressionConverter(this);
        this.patterns = new PatternConverter(this);
        this.jsx = new JsxConverter(this);
        this.types = new TypeScriptConverter(this);
    }

    public SourceText source() {
        return source;
    }

    public SourceType sourceType() {
        return sourceType;
    }

    StatementConverter statements() {
        return statements;
    }

    ExpressionConverter expressions() {
        return expressions;
    }

    PatternConverter patterns() {
        return patterns;
    }

    JsxConverter jsx() {
        return jsx;
    }

    TypeScriptConverter types() {
        return types;
    }

    /**
     * Number of child conversions that failed and were dropped.
     */
    public int swallowedFailures() {
        return swallowed;
    }

    /**
     * Whether conversion has nested deep enough that the current node should not be descended.
     */
    boolean tooDeep() {
        if (depth < MAX_DEPTH) {
            return false;
        }
        if (!truncated) {
            truncated = true;
            log.warn("Nesting deeper than {} levels, keeping inner nodes as generic", MAX_DEPTH);
        }
        return true;
    }

    SourceLocation loc(TSNode node) {
        return loc(node.getStartByte(), node.getEndByte());
    }

    SourceLocation loc(int startByte, int endByte) {
        int length = source.byteLength();
        int start = Math.max(0, Math.min(startByte, length));
        int end = Math.max(start, Math.min(endByte, length));
        return new SourceLocation(start, end, source.lineAt(start), source.lineAt(end));
    }

    /**
     * Location running from the start of {@code first} to the end of {@code last}.
     */
    SourceLocation loc(TSNode first, TSNode last) {
        return loc(first.getStartByte(), last.getEndByte());
    }

    String text(TSNode node) {
        return source.textOf(node.getStartByte(), node.getEndByte());
    }

    GenericNode generic(String type, TSNode node) {
        return new GenericNode(type, loc(node));
    }

    /**
     * Runs one child conversion. A missing child or a failed conversion yields {@code null},
     * so the parent is built without that field.
     */
    <T> T convert(TSNode node, Function<TSNode, T> conversion) {
        if (Cst.isAbsent(node) || node.isMissing()) {
            return null;
        }
        depth++;
        try {
            return conversion.apply(node);
        } catch (RuntimeException e) {
            swallowed++;
            log.debug("Dropping {} at {}..{}: {}", node.getType(), node.getStartByte(), node.getEndByte(), e.toString());
            return null;
        } catch (StackOverflowError e) {
            swallowed++;
            log.warn("Stack exhausted converting {} at {}..{}, dropping it", node.getType(), node.getStartByte(), node.getEndByte());
            return null;
        } finally {
            depth--;
        }
    }

    /**
     * Converts each node in order, dropping the ones that yield nothing. The returned list is
     * unmodifiable.
     */
    <T> List<T> convertAll(List<TSNode> nodes, Function<TSNode, T> conversion) {
        List<T> result = new ArrayList<>(nodes.size());
        for (TSNode node : nodes) {
            T converted = convert(node, conversion);
            if (converted != null) {
                result.add(converted);
            }
        }
        return List.copyOf(result);
    }
}
