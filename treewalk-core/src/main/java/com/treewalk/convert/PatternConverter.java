package com.treewalk.convert;

import com.treewalk.ast.AssignmentPattern;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.Node;
import com.treewalk.ast.NodeType;
import com.treewalk.ast.Pattern;
import com.treewalk.ast.RestElement;
import com.treewalk.ast.SourceLocation;
import com.treewalk.ast.TSTypeAnnotation;
import org.treesitter.TSNode;

import java.util.List;

/**
 * Converts binding identifiers, parameters, defaults and rest elements.
 *
 * <p>Destructuring is not modelled structurally: a destructured parameter becomes an
 * {@link Identifier} named {@value #PLACEHOLDER}, and a destructured declaration or assignment
 * target becomes a generic {@code ObjectPattern} / {@code ArrayPattern}.</p>
 */
final class PatternConverter {

    static final String PLACEHOLDER = "param";

    private final ConversionContext ctx;

    PatternConverter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    List<Pattern> params(TSNode formalParameters) {
        if (formalParameters == null) {
            return List.of();
        }
        return ctx.convertAll(Cst.namedChildren(formalParameters), this::param);
    }

    Pattern param(TSNode node) {
        return switch (node.getType()) {
            case "identifier", "undefined" -> ctx.expressions().identifier(node);
            case "this" -> new Identifier(ctx.loc(node), "this");
            case "required_parameter", "optional_parameter" -> typedParam(node);
            case "assignment_pattern" -> new AssignmentPattern(ctx.loc(node),
                ctx.convert(Cst.field(node, "left"), this::param),
                ctx.convert(Cst.field(node, "right"), ctx.expressions()::convert));
            case "rest_pattern" -> new RestElement(ctx.loc(node),
                ctx.convert(Cst.firstNamed(node), this::param), null);
            default -> placeholder(ctx.loc(node), null);
        };
    }

    /**
     * TypeScript parameter: {@code pattern}, optional {@code type} annotation and default {@code value}.
     */
    private Pattern typedParam(TSNode node) {
        TSNode pattern = Cst.field(node, "pattern");
        TSNode type = Cst.field(node, "type");
        TSNode value = Cst.field(node, "value");
        if (pattern == null) {
            return placeholder(ctx.loc(node), null);
        }
        TSTypeAnnotation annotation = ctx.convert(type, ctx.types()::typeAnnotation);
        SourceLocation targetLoc = type != null ? ctx.loc(pattern, type) : ctx.loc(pattern);

        Pattern target = switch (pattern.getType()) {
            case "identifier" -> new Identifier(targetLoc, ctx.text(pattern), annotation);
            case "this" -> new Identifier(targetLoc, "this", annotation);
            case "rest_pattern" -> new RestElement(targetLoc,
                ctx.convert(Cst.firstNamed(pattern), this::param), annotation);
            default -> placeholder(targetLoc, annotation);
        };
        if (value == null) {
            return target;
        }
        return new AssignmentPattern(ctx.loc(node), target, ctx.convert(value, ctx.expressions()::convert));
    }

    private Identifier placeholder(SourceLocation loc, TSTypeAnnotation annotation) {
        return new Identifier(loc, PLACEHOLDER, annotation);
    }

    /**
     * Target of a variable declarator.
     */
    Pattern bindingTarget(TSNode node) {
        return switch (node.getType()) {
            case "identifier", "undefined" -> ctx.expressions().identifier(node);
            case "object_pattern" -> ctx.generic(NodeType.OBJECT_PATTERN, node);
            case "array_pattern" -> ctx.generic(NodeType.ARRAY_PATTERN, node);
            default -> ctx.generic(NodeType.ASSIGNMENT_TARGET, node);
        };
    }

    /**
     * Parameter of a catch clause; anything but a plain identifier becomes the placeholder.
     */
    Pattern catchParam(TSNode node) {
        if ("identifier".equals(node.getType())) {
            return ctx.expressions().identifier(node);
        }
        return placeholder(ctx.loc(node), null);
    }

    /**
     * Left-hand side of an assignment or of a for-in / for-of head without a declaration.
     */
    Node assignmentTarget(TSNode node) {
        TSNode target = Cst.unwrapParens(node);
        return switch (target.getType()) {
            case "identifier", "undefined" -> ctx.expressions().identifier(target);
            case "object_pattern", "object" -> ctx.generic(NodeType.OBJECT_PATTERN, target);
            case "array_pattern", "array" -> ctx.generic(NodeType.ARRAY_PATTERN, target);
            case "member_expression", "subscript_expression" -> ctx.expressions().convert(target);
            default -> ctx.generic(NodeType.ASSIGNMENT_TARGET, target);
        };
    }
}
