package com.treewalk;

import com.treewalk.ast.Program;
import com.treewalk.convert.Converter;
import com.treewalk.convert.CstScanner;
import com.treewalk.convert.TsxMerger;
import com.treewalk.source.SourceText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

import java.util.List;

/**
 * Parses JavaScript, JSX and TypeScript source into the node model.
 *
 * <p>Instances keep their tree-sitter parsers between calls and are not thread-safe. Syntax
 * errors never throw; they are reported in the {@link ParseResult}.</p>
 *
 * <pre>{@code
 * ParseResult result = JsParser.parseSource("const x = 1;", "module");
 * for (Visit visit : result.walk()) {
 *     System.out.println(visit.depth() + " " + visit.node().type());
 * }
 * }</pre>
 */
public class JsParser {
    private static final Logger log = LogManager.getLogger(JsParser.class);

    private TSParser javaScriptParser;
    private TSParser typeScriptParser;

    public ParseResult parse(String source) {
        return parse(source, ParseOptions.defaults());
    }

    public ParseResult parse(String source, SourceType sourceType) {
        return parse(source, ParseOptions.of(sourceType));
    }

    public ParseResult parse(String source, ParseOptions options) {
        if (source == null) {
            throw new ParseException("Source must not be null");
        }
        SourceText text = SourceText.of(source);
        if (options.sourceType() == SourceType.TSX) {
            return parseTsx(source, text, options);
        }
        TSParser parser = parserFor(options.sourceType());
        TSTree tree = parser.parseString(null, source);
        if (tree == null) {
            log.warn("Parser produced no tree for {} bytes of {}", text.byteLength(), options.sourceType().id());
            Program program = Converter.emptyProgram(text, options.sourceType());
            ParseError error = new ParseError("Parser produced no syntax tree", text.fullSpan());
            return new ParseResult(program, List.of(error), List.of(), true, text);
        }

        TSNode root = tree.getRootNode();
        Program program = new Converter(text, options.sourceType()).convert(root);
        List<ParseError> errors = options.reportDiagnostics() ? CstScanner.diagnostics(root, text) : List.of();
        List<Comment> comments = options.collectComments() ? CstScanner.comments(root, text) : List.of();
        if (!errors.isEmpty()) {
            log.debug("{} diagnostics in {} source", errors.size(), options.sourceType().id());
        }
        return new ParseResult(program, errors, comments, false, text);
    }

    /**
     * TSX is parsed with both the TypeScript and the JSX grammar and the two trees are merged
     * per top-level segment.
     */
    private ParseResult parseTsx(String source, SourceText text, ParseOptions options) {
        TSTree typed = parserFor(SourceType.TYPESCRIPT).parseString(null, source);
        TSTree jsx = parserFor(SourceType.JSX).parseString(null, source);
        if (typed == null || jsx == null) {
            log.warn("Parser produced no tree for {} bytes of tsx", text.byteLength());
            Program program = Converter.emptyProgram(text, SourceType.TSX);
            ParseError error = new ParseError("Parser produced no syntax tree", text.fullSpan());
            return new ParseResult(program, List.of(error), List.of(), true, text);
        }

        TsxMerger.Merged merged = TsxMerger.merge(typed.getRootNode(), jsx.getRootNode(), text);
        Program program = new Converter(text, SourceType.TSX).convert(merged.statements());
        List<ParseError> errors = options.reportDiagnostics() ? merged.errors() : List.of();
        List<Comment> comments = options.collectComments() ? merged.comments() : List.of();
        if (!errors.isEmpty()) {
            log.debug("{} diagnostics in tsx source", errors.size());
        }
        return new ParseResult(program, errors, comments, false, text);
    }

    /**
     * Parses with a fresh parser, resolving the source type by name ({@code module},
     * {@code script}, {@code jsx}, {@code ts}, {@code typescript} or {@code tsx}).
     */
    public static ParseResult parseSource(String source, String sourceType) {
        return new JsParser().parse(source, SourceType.fromName(sourceType));
    }

    public static ParseResult parseSource(String source) {
        return new JsParser().parse(source);
    }

    private TSParser parserFor(SourceType sourceType) {
        if (sourceType.isTypeScript()) {
            if (typeScriptParser == null) {
                typeScriptParser = newParser(sourceType);
            }
            return typeScriptParser;
        }
        if (javaScriptParser == null) {
            javaScriptParser = newParser(sourceType);
        }
        return javaScriptParser;
    }

    private static TSParser newParser(SourceType sourceType) {
        try {
            TSLanguage language = sourceType.isTypeScript() ? new TreeSitterTypescript() : new TreeSitterJavascript();
            TSParser parser = new TSParser();
            parser.setLanguage(language);
            return parser;
        } catch (RuntimeException | LinkageError e) {
            throw new ParseException("Cannot load grammar for source type " + sourceType.id(), e);
        }
    }
}
