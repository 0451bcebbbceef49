package com.treewalk;

import com.treewalk.ast.Node;
import com.treewalk.ast.Program;
import com.treewalk.source.SourceText;
import com.treewalk.walk.TraversalOrder;
import com.treewalk.walk.Walker;

import java.util.List;

/**
 * Outcome of one parse: the converted program plus diagnostics, comments and the source buffer
 * every node's offsets refer to.
 *
 * @param panicked true when the parser produced no tree at all
 */
public record ParseResult(
    Program program,
    List<ParseError> errors,
    List<Comment> comments,
    boolean panicked,
    SourceText source
) {
    public ParseResult {
        errors = List.copyOf(errors);
        comments = List.copyOf(comments);
    }

    /**
     * True iff there are no diagnostics and the parser did not give up.
     */
    public boolean isValid() {
        return errors.isEmpty() && !panicked;
    }

    public String textOf(Node node) {
        return node.text(source);
    }

    public Walker walk() {
        return Walker.of(program);
    }

    public Walker walk(TraversalOrder order) {
        return Walker.of(program, order);
    }
}
