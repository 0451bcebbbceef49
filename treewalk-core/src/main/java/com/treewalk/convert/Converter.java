package com.treewalk.convert;

import com.treewalk.SourceType;
import com.treewalk.ast.Program;
import com.treewalk.ast.SourceLocation;
import com.treewalk.ast.Statement;
import com.treewalk.source.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.util.List;

/**
 * Maps a tree-sitter syntax tree onto the node model.
 *
 * <p>Conversion is bottom-up and never fails on malformed input: unmodelled constructs become
 * generic nodes and failed child conversions are dropped from their parent. The resulting tree
 * holds no reference to the tree-sitter tree.</p>
 */
public final class Converter {
    private static final Logger log = LogManager.getLogger(Converter.class);

    private final ConversionContext ctx;

    public Converter(SourceText source, SourceType sourceType) {
        this.ctx = new ConversionContext(source, sourceType);
    }

    /**
     * Converts a whole tree. The program always spans the full source.
     */
    public Program convert(TSNode root) {
        List<Statement> body = Cst.isAbsent(root) ? List.of() : ctx.statements().statementList(root);
        if (ctx.swallowedFailures() > 0) {
            log.debug("Dropped {} child conversions", ctx.swallowedFailures());
        }
        return program(ctx.source(), ctx.sourceType(), body);
    }

    /**
     * Converts top-level statements already chosen from one or more trees over the same source.
     */
    public Program convert(List<TSNode> topLevel) {
        List<Statement> body = ctx.statements().statementList(topLevel);
        if (ctx.swallowedFailures() > 0) {
            log.debug("Dropped {} child conversions", ctx.swallowedFailures());
        }
        return program(ctx.source(), ctx.sourceType(), body);
    }

    public ConversionContext context() {
        return ctx;
    }

    public static Program emptyProgram(SourceText source, SourceType sourceType) {
        return program(source, sourceType, List.of());
    }

    private static Program program(SourceText source, SourceType sourceType, List<Statement> body) {
        int length = source.byteLength();
        SourceLocation loc = new SourceLocation(0, length, source.lineAt(0), source.lineAt(length));
        return new Program(loc, body, programSourceType(sourceType));
    }

    private static String programSourceType(SourceType sourceType) {
        return sourceType == SourceType.SCRIPT ? "script" : "module";
    }
}
