package com.treewalk.convert;

import com.treewalk.ast.Identifier;
import com.treewalk.ast.Node;
import com.treewalk.ast.NodeType;
import com.treewalk.ast.SourceLocation;
import com.treewalk.ast.TSArrayType;
import com.treewalk.ast.TSEnumDeclaration;
import com.treewalk.ast.TSEnumMember;
import com.treewalk.ast.TSInterfaceBody;
import com.treewalk.ast.TSInterfaceDeclaration;
import com.treewalk.ast.TSInterfaceHeritage;
import com.treewalk.ast.TSIntersectionType;
import com.treewalk.ast.TSMethodSignature;
import com.treewalk.ast.TSPropertySignature;
import com.treewalk.ast.TSSignature;
import com.treewalk.ast.TSType;
import com.treewalk.ast.TSTypeAliasDeclaration;
import com.treewalk.ast.TSTypeAnnotation;
import com.treewalk.ast.TSTypeParameter;
import com.treewalk.ast.TSTypeParameterDeclaration;
import com.treewalk.ast.TSTypeParameterInstantiation;
import com.treewalk.ast.TSTypeReference;
import com.treewalk.ast.TSUnionType;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts type annotations, type parameters, interfaces, enums, aliases and type forms.
 * Type forms without a dedicated kind become generic nodes named after their TypeScript-ESTree type.
 */
final class TypeScriptConverter {

    private static final Map<String, String> KEYWORDS = Map.ofEntries(
        Map.entry("string", NodeType.TS_STRING_KEYWORD),
        Map.entry("number", NodeType.TS_NUMBER_KEYWORD),
        Map.entry("boolean", NodeType.TS_BOOLEAN_KEYWORD),
        Map.entry("any", NodeType.TS_ANY_KEYWORD),
        Map.entry("unknown", NodeType.TS_UNKNOWN_KEYWORD),
        Map.entry("void", NodeType.TS_VOID_KEYWORD),
        Map.entry("never", NodeType.TS_NEVER_KEYWORD),
        Map.entry("null", NodeType.TS_NULL_KEYWORD),
        Map.entry("undefined", NodeType.TS_UNDEFINED_KEYWORD),
        Map.entry("object", NodeType.TS_OBJECT_KEYWORD),
        Map.entry("symbol", NodeType.TS_SYMBOL_KEYWORD),
        Map.entry("bigint", NodeType.TS_BIG_INT_KEYWORD));

    private static final Map<String, String> GENERIC_TYPES = Map.ofEntries(
        Map.entry("object_type", NodeType.TS_TYPE_LITERAL),
        Map.entry("function_type", NodeType.TS_FUNCTION_TYPE),
        Map.entry("constructor_type", NodeType.TS_FUNCTION_TYPE),
        Map.entry("tuple_type", NodeType.TS_TUPLE_TYPE),
        Map.entry("readonly_type", NodeType.TS_TYPE_OPERATOR),
        Map.entry("index_type_query", NodeType.TS_TYPE_OPERATOR),
        Map.entry("type_query", NodeType.TS_TYPE_QUERY),
        Map.entry("lookup_type", NodeType.TS_INDEXED_ACCESS_TYPE),
        Map.entry("conditional_type", NodeType.TS_CONDITIONAL_TYPE),
        Map.entry("infer_type", NodeType.TS_INFER_TYPE),
        Map.entry("this_type", NodeType.TS_THIS_TYPE),
        Map.entry("template_literal_type", NodeType.TS_TEMPLATE_LITERAL_TYPE),
        Map.entry("type_predicate", NodeType.TS_TYPE_PREDICATE),
        Map.entry("asserts", NodeType.TS_TYPE_PREDICATE),
        Map.entry("import_type", NodeType.TS_IMPORT_TYPE),
        Map.entry("mapped_type_clause", NodeType.TS_MAPPED_TYPE));

    private final ConversionContext ctx;

    TypeScriptConverter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * A {@code : T} annotation. Predicate and asserts annotations keep their inner form.
     */
    TSTypeAnnotation typeAnnotation(TSNode node) {
        TSNode inner = node.getType().endsWith("_annotation") ? Cst.firstNamed(node) : node;
        return new TSTypeAnnotation(ctx.loc(node), ctx.convert(inner, this::type));
    }

    TSType type(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        String type = node.getType();
        return switch (type) {
            case "type_identifier", "nested_type_identifier", "identifier" ->
                new TSTypeReference(loc, new Identifier(loc, ctx.text(node)), null);
            case "generic_type" -> {
                TSNode name = Cst.field(node, "name");
                yield new TSTypeReference(loc,
                    ctx.convert(name, n -> new Identifier(ctx.loc(n), ctx.text(n))),
                    ctx.convert(Cst.field(node, "type_arguments"), this::typeArguments));
            }
            case "predefined_type" -> ctx.generic(KEYWORDS.getOrDefault(ctx.text(node), NodeType.UNKNOWN), node);
            case "literal_type" -> {
                String text = ctx.text(node);
                if ("null".equals(text) || "undefined".equals(text)) {
                    yield ctx.generic(KEYWORDS.get(text), node);
                }
                yield ctx.generic(NodeType.TS_LITERAL_TYPE, node);
            }
            case "union_type" -> new TSUnionType(loc, ctx.convertAll(flatten(node, type), this::type));
            case "intersection_type" -> new TSIntersectionType(loc, ctx.convertAll(flatten(node, type), this::type));
            case "array_type" -> new TSArrayType(loc, ctx.convert(Cst.firstNamed(node), this::type));
            case "parenthesized_type" -> {
                TSNode inner = Cst.firstNamed(node);
                yield inner != null ? type(inner) : ctx.generic(NodeType.TS_PARENTHESIZED_TYPE, node);
            }
            default -> ctx.generic(GENERIC_TYPES.getOrDefault(type, NodeType.UNKNOWN), node);
        };
    }

    /**
     * Operands of a left-nested union or intersection, in source order.
     */
    private List<TSNode> flatten(TSNode node, String type) {
        List<TSNode> operands = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            if (type.equals(child.getType())) {
                operands.addAll(flatten(child, type));
            } else {
                operands.add(child);
            }
        }
        return operands;
    }

    TSTypeParameterDeclaration typeParameters(TSNode node) {
        return new TSTypeParameterDeclaration(ctx.loc(node),
            ctx.convertAll(Cst.namedChildren(node), this::typeParameter));
    }

    private TSTypeParameter typeParameter(TSNode node) {
        TSNode name = Cst.field(node, "name");
        TSNode constraint = Cst.field(node, "constraint");
        TSNode value = Cst.field(node, "value");
        return new TSTypeParameter(ctx.loc(node),
            name != null ? ctx.text(name) : ctx.text(node),
            constraint != null ? ctx.convert(Cst.firstNamed(constraint), this::type) : null,
            value != null ? ctx.convert(Cst.firstNamed(value), this::type) : null);
    }

    TSTypeParameterInstantiation typeArguments(TSNode node) {
        return new TSTypeParameterInstantiation(ctx.loc(node),
            ctx.convertAll(Cst.namedChildren(node), this::type));
    }

    TSTypeAliasDeclaration typeAlias(TSNode node) {
        return new TSTypeAliasDeclaration(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            ctx.convert(Cst.field(node, "type_parameters"), this::typeParameters),
            ctx.convert(Cst.field(node, "value"), this::type));
    }

    TSInterfaceDeclaration interfaceDeclaration(TSNode node) {
        TSNode extendsClause = Cst.firstOfType(node, "extends_type_clause");
        List<TSInterfaceHeritage> heritage = extendsClause != null
            ? ctx.convertAll(Cst.namedChildren(extendsClause), this::heritage)
            : List.of();
        return new TSInterfaceDeclaration(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            ctx.convert(Cst.field(node, "type_parameters"), this::typeParameters),
            heritage,
            ctx.convert(Cst.field(node, "body"), this::interfaceBody));
    }

    /**
     * One entry of an {@code extends} or {@code implements} list.
     */
    TSInterfaceHeritage heritage(TSNode node) {
        if ("generic_type".equals(node.getType())) {
            TSNode name = Cst.field(node, "name");
            return new TSInterfaceHeritage(ctx.loc(node),
                ctx.convert(name, ctx.expressions()::identifier),
                ctx.convert(Cst.field(node, "type_arguments"), this::typeArguments));
        }
        return new TSInterfaceHeritage(ctx.loc(node), ctx.expressions().identifier(node), null);
    }

    private TSInterfaceBody interfaceBody(TSNode node) {
        return new TSInterfaceBody(ctx.loc(node), ctx.convertAll(Cst.namedChildren(node), this::signature));
    }

    private TSSignature signature(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        return switch (node.getType()) {
            case "property_signature" -> {
                TSNode key = Cst.field(node, "name");
                yield new TSPropertySignature(loc,
                    ctx.convert(key, ctx.expressions()::propertyKey),
                    key != null && "computed_property_name".equals(key.getType()),
                    Cst.hasToken(node, "?"),
                    Cst.hasToken(node, "readonly"),
                    ctx.convert(Cst.field(node, "type"), this::typeAnnotation));
            }
            case "method_signature" -> new TSMethodSignature(loc,
                ctx.convert(Cst.field(node, "name"), ctx.expressions()::propertyKey),
                Cst.hasToken(node, "?"),
                ctx.patterns().params(Cst.field(node, "parameters")),
                ctx.convert(Cst.field(node, "return_type"), this::typeAnnotation));
            case "call_signature" -> ctx.generic(NodeType.TS_CALL_SIGNATURE_DECLARATION, node);
            case "construct_signature" -> ctx.generic(NodeType.TS_CONSTRUCT_SIGNATURE_DECLARATION, node);
            case "index_signature" -> ctx.generic(NodeType.TS_INDEX_SIGNATURE, node);
            default -> ctx.generic(NodeType.UNKNOWN, node);
        };
    }

    TSEnumDeclaration enumDeclaration(TSNode node) {
        return new TSEnumDeclaration(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            ctx.convertAll(Cst.namedChildren(Cst.field(node, "body")), this::enumMember),
            Cst.hasToken(node, "const"));
    }

    private TSEnumMember enumMember(TSNode node) {
        if ("enum_assignment".equals(node.getType())) {
            return new TSEnumMember(ctx.loc(node),
                ctx.convert(Cst.field(node, "name"), this::enumKey),
                ctx.convert(Cst.field(node, "value"), ctx.expressions()::convert));
        }
        return new TSEnumMember(ctx.loc(node), enumKey(node), null);
    }

    private Node enumKey(TSNode node) {
        if ("string".equals(node.getType()) || "number".equals(node.getType())) {
            return ctx.expressions().literal(node);
        }
        return ctx.expressions().identifier(node);
    }
}
