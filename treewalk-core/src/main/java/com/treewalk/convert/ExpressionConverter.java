package com.treewalk.convert;

import com.treewalk.ast.ArrayExpression;
import com.treewalk.ast.ArrowFunctionExpression;
import com.treewalk.ast.AssignmentExpression;
import com.treewalk.ast.AwaitExpression;
import com.treewalk.ast.BinaryExpression;
import com.treewalk.ast.BlockStatement;
import com.treewalk.ast.CallExpression;
import com.treewalk.ast.ConditionalExpression;
import com.treewalk.ast.Expression;
import com.treewalk.ast.FunctionExpression;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.ImportExpression;
import com.treewalk.ast.Literal;
import com.treewalk.ast.LogicalExpression;
import com.treewalk.ast.MemberExpression;
import com.treewalk.ast.MetaProperty;
import com.treewalk.ast.NewExpression;
import com.treewalk.ast.Node;
import com.treewalk.ast.NodeType;
import com.treewalk.ast.ObjectExpression;
import com.treewalk.ast.Pattern;
import com.treewalk.ast.PrivateIdentifier;
import com.treewalk.ast.Property;
import com.treewalk.ast.SequenceExpression;
import com.treewalk.ast.SourceLocation;
import com.treewalk.ast.SpreadElement;
import com.treewalk.ast.Super;
import com.treewalk.ast.TSTypeAnnotation;
import com.treewalk.ast.TSTypeParameterDeclaration;
import com.treewalk.ast.TaggedTemplateExpression;
import com.treewalk.ast.TemplateElement;
import com.treewalk.ast.TemplateLiteral;
import com.treewalk.ast.ThisExpression;
import com.treewalk.ast.UnaryExpression;
import com.treewalk.ast.UpdateExpression;
import com.treewalk.ast.YieldExpression;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts expressions, literals, templates and function values.
 */
final class ExpressionConverter {
    private static final Logger log = LogManager.getLogger(ExpressionConverter.class);

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "??");

    private final ConversionContext ctx;

    ExpressionConverter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Converts any expression node. Never returns {@code null}: constructs without a dedicated
     * kind become generic nodes.
     */
    Expression convert(TSNode node) {
        if (ctx.tooDeep()) {
            return ctx.generic(NodeType.EXPRESSION, node);
        }
        return switch (node.getType()) {
            case "identifier", "shorthand_property_identifier", "property_identifier",
                 "statement_identifier", "type_identifier", "undefined" -> identifier(node);
            case "private_property_identifier" -> new PrivateIdentifier(ctx.loc(node), ctx.text(node).substring(1));
            case "this" -> new ThisExpression(ctx.loc(node));
            case "super" -> new Super(ctx.loc(node));
            case "number", "string", "true", "false", "null", "regex" -> literal(node);
            case "template_string" -> templateLiteral(node);
            case "array" -> array(node);
            case "object" -> object(node);
            case "function_expression", "function", "generator_function" -> function(node);
            case "arrow_function" -> arrow(node);
            case "class" -> ctx.statements().classExpression(node);
            case "call_expression" -> call(node);
            case "new_expression" -> newExpression(node);
            case "member_expression" -> member(node);
            case "subscript_expression" -> subscript(node);
            case "assignment_expression", "augmented_assignment_expression" -> assignment(node);
            case "unary_expression" -> unary(node);
            case "update_expression" -> update(node);
            case "binary_expression" -> binary(node);
            case "ternary_expression" -> ternary(node);
            case "sequence_expression" -> sequence(node);
            case "parenthesized_expression" -> parenthesized(node);
            case "await_expression" -> new AwaitExpression(ctx.loc(node), ctx.convert(Cst.firstNamed(node), this::convert));
            case "yield_expression" -> new YieldExpression(ctx.loc(node),
                ctx.convert(Cst.firstNamed(node), this::convert), Cst.hasToken(node, "*"));
            case "meta_property" -> metaProperty(node);
            case "jsx_element", "jsx_self_closing_element", "jsx_fragment" -> ctx.jsx().element(node);
            case "as_expression" -> ctx.generic(NodeType.TS_AS_EXPRESSION, node);
            case "satisfies_expression" -> ctx.generic(NodeType.TS_SATISFIES_EXPRESSION, node);
            case "non_null_expression" -> ctx.generic(NodeType.TS_NON_NULL_EXPRESSION, node);
            case "type_assertion" -> ctx.generic(NodeType.TS_TYPE_ASSERTION, node);
            case "internal_module", "module" -> ctx.generic(NodeType.TS_MODULE_DECLARATION, node);
            case "ERROR" -> ctx.generic(NodeType.UNKNOWN, node);
            default -> {
                log.debug("No expression kind for '{}', using generic node", node.getType());
                yield ctx.generic(NodeType.EXPRESSION, node);
            }
        };
    }

    Identifier identifier(TSNode node) {
        return new Identifier(ctx.loc(node), ctx.text(node));
    }

    Literal literal(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        String raw = ctx.text(node);
        return switch (node.getType()) {
            case "true" -> new Literal(loc, Boolean.TRUE, raw);
            case "false" -> new Literal(loc, Boolean.FALSE, raw);
            case "null" -> new Literal(loc, null, raw);
            case "string" -> new Literal(loc, JsStrings.cookString(raw), raw);
            case "regex" -> {
                TSNode pattern = Cst.field(node, "pattern");
                TSNode flags = Cst.field(node, "flags");
                Literal.RegExp regex = new Literal.RegExp(
                    pattern != null ? ctx.text(pattern) : "",
                    flags != null ? ctx.text(flags) : "");
                yield new Literal(loc, null, raw, regex, null);
            }
            default -> number(loc, raw);
        };
    }

    private Literal number(SourceLocation loc, String raw) {
        if (raw.endsWith("n")) {
            String digits = raw.substring(0, raw.length() - 1).replace("_", "");
            return new Literal(loc, JsStrings.parseBigInt(raw), raw, null, digits);
        }
        try {
            return new Literal(loc, JsStrings.parseNumber(raw), raw);
        } catch (NumberFormatException e) {
            log.debug("Unparseable number literal '{}': {}", raw, e.getMessage());
            return new Literal(loc, null, raw);
        }
    }

    TemplateLiteral templateLiteral(TSNode node) {
        List<TemplateElement> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        int closing = Math.max(node.getStartByte() + 1, node.getEndByte() - 1);
        int segmentStart = node.getStartByte() + 1;
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (Cst.isAbsent(child) || !"template_substitution".equals(child.getType())) {
                continue;
            }
            quasis.add(templateElement(segmentStart, child.getStartByte(), false));
            Expression expression = ctx.convert(Cst.firstNamed(child), this::convert);
            if (expression != null) {
                expressions.add(expression);
            }
            segmentStart = child.getEndByte();
        }
        quasis.add(templateElement(segmentStart, Math.max(segmentStart, closing), true));
        return new TemplateLiteral(ctx.loc(node), List.copyOf(quasis), List.copyOf(expressions));
    }

    private TemplateElement templateElement(int start, int end, boolean tail) {
        String raw = ctx.source().textOf(start, end);
        return new TemplateElement(ctx.loc(start, end),
            new TemplateElement.TemplateElementValue(raw, JsStrings.unescape(raw)), tail);
    }

    private ArrayExpression array(TSNode node) {
        return new ArrayExpression(ctx.loc(node), ctx.convertAll(Cst.namedChildren(node), this::element));
    }

    /**
     * Array element or call argument: an expression or a spread.
     */
    Node element(TSNode node) {
        if ("spread_element".equals(node.getType())) {
            return spread(node);
        }
        return convert(node);
    }

    SpreadElement spread(TSNode node) {
        return new SpreadElement(ctx.loc(node), ctx.convert(Cst.firstNamed(node), this::convert));
    }

    private ObjectExpression object(TSNode node) {
        return new ObjectExpression(ctx.loc(node), ctx.convertAll(Cst.namedChildren(node), this::objectMember));
    }

    private Node objectMember(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        return switch (node.getType()) {
            case "pair" -> {
                TSNode key = Cst.field(node, "key");
                boolean computed = key != null && "computed_property_name".equals(key.getType());
                yield new Property(loc, ctx.convert(key, this::propertyKey),
                    ctx.convert(Cst.field(node, "value"), this::convert), "init", false, false, computed);
            }
            case "shorthand_property_identifier" ->
                new Property(loc, identifier(node), identifier(node), "init", false, true, false);
            case "method_definition" -> {
                TSNode key = Cst.field(node, "name");
                String kind = methodKind(node);
                boolean computed = key != null && "computed_property_name".equals(key.getType());
                yield new Property(loc, ctx.convert(key, this::propertyKey), method(node),
                    "method".equals(kind) ? "init" : kind, "method".equals(kind), false, computed);
            }
            case "spread_element" -> spread(node);
            default -> ctx.generic(NodeType.UNKNOWN, node);
        };
    }

    /**
     * Key of a property, method or class member. Computed keys yield the inner expression.
     */
    Node propertyKey(TSNode node) {
        return switch (node.getType()) {
            case "property_identifier", "identifier", "type_identifier" -> identifier(node);
            case "private_property_identifier" -> new PrivateIdentifier(ctx.loc(node), ctx.text(node).substring(1));
            case "string", "number" -> literal(node);
            case "computed_property_name" -> {
                TSNode inner = Cst.firstNamed(node);
                yield inner != null ? convert(inner) : ctx.generic(NodeType.EXPRESSION, node);
            }
            default -> convert(node);
        };
    }

    /**
     * One of {@code constructor}, {@code method}, {@code get} or {@code set}.
     */
    String methodKind(TSNode node) {
        if (Cst.hasToken(node, "get")) {
            return "get";
        }
        if (Cst.hasToken(node, "set")) {
            return "set";
        }
        TSNode name = Cst.field(node, "name");
        if (name != null && "constructor".equals(ctx.text(name)) && !Cst.hasToken(node, "static")) {
            return "constructor";
        }
        return "method";
    }

    /**
     * The function value of a method: spans from the parameter list to the end of the body.
     */
    FunctionExpression method(TSNode node) {
        TSNode parameters = Cst.field(node, "parameters");
        SourceLocation loc = parameters != null ? ctx.loc(parameters, node) : ctx.loc(node);
        return new FunctionExpression(loc, null,
            Cst.hasToken(node, "async"),
            Cst.hasToken(node, "*"),
            ctx.patterns().params(parameters),
            ctx.convert(Cst.field(node, "body"), ctx.statements()::block),
            ctx.convert(Cst.field(node, "type_parameters"), ctx.types()::typeParameters),
            ctx.convert(Cst.field(node, "return_type"), ctx.types()::typeAnnotation));
    }

    FunctionExpression function(TSNode node) {
        return new FunctionExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), this::identifier),
            Cst.hasToken(node, "async"),
            Cst.hasToken(node, "*") || node.getType().startsWith("generator"),
            ctx.patterns().params(Cst.field(node, "parameters")),
            ctx.convert(Cst.field(node, "body"), ctx.statements()::block),
            ctx.convert(Cst.field(node, "type_parameters"), ctx.types()::typeParameters),
            ctx.convert(Cst.field(node, "return_type"), ctx.types()::typeAnnotation));
    }

    private ArrowFunctionExpression arrow(TSNode node) {
        List<Pattern> params;
        TSNode single = Cst.field(node, "parameter");
        if (single != null) {
            Pattern param = ctx.convert(single, ctx.patterns()::param);
            params = param != null ? List.of(param) : List.of();
        } else {
            params = ctx.patterns().params(Cst.field(node, "parameters"));
        }

        TSNode bodyNode = Cst.field(node, "body");
        boolean expressionBody = bodyNode != null && !"statement_block".equals(bodyNode.getType());
        Node body;
        if (bodyNode == null) {
            body = null;
        } else if (expressionBody) {
            body = ctx.convert(bodyNode, this::convert);
        } else {
            BlockStatement block = ctx.convert(bodyNode, ctx.statements()::block);
            body = block;
        }
        TSTypeParameterDeclaration typeParameters = ctx.convert(Cst.field(node, "type_parameters"), ctx.types()::typeParameters);
        TSTypeAnnotation returnType = ctx.convert(Cst.field(node, "return_type"), ctx.types()::typeAnnotation);
        return new ArrowFunctionExpression(ctx.loc(node), Cst.hasToken(node, "async"), expressionBody,
            params, body, typeParameters, returnType);
    }

    private Expression call(TSNode node) {
        TSNode function = Cst.field(node, "function");
        TSNode arguments = Cst.field(node, "arguments");
        if (function != null && "import".equals(function.getType())) {
            TSNode source = arguments != null ? Cst.firstNamed(arguments) : null;
            return new ImportExpression(ctx.loc(node), ctx.convert(source, this::convert));
        }
        Expression callee = ctx.convert(function, this::convert);
        if (arguments != null && "template_string".equals(arguments.getType())) {
            return new TaggedTemplateExpression(ctx.loc(node), callee, ctx.convert(arguments, this::templateLiteral));
        }
        boolean optional = Cst.firstOfType(node, "optional_chain") != null;
        return new CallExpression(ctx.loc(node), callee, arguments(arguments), optional);
    }

    private NewExpression newExpression(TSNode node) {
        return new NewExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "constructor"), this::convert),
            arguments(Cst.field(node, "arguments")));
    }

    private List<Node> arguments(TSNode node) {
        if (node == null) {
            return List.of();
        }
        return ctx.convertAll(Cst.namedChildren(node), this::element);
    }

    private Expression member(TSNode node) {
        TSNode property = Cst.field(node, "property");
        if (property != null && "private_property_identifier".equals(property.getType())) {
            return ctx.generic(NodeType.MEMBER_EXPRESSION, node);
        }
        boolean optional = Cst.firstOfType(node, "optional_chain") != null;
        return new MemberExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "object"), this::convert),
            ctx.convert(property, this::identifier),
            false,
            optional);
    }

    private MemberExpression subscript(TSNode node) {
        boolean optional = Cst.firstOfType(node, "optional_chain") != null;
        return new MemberExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "object"), this::convert),
            ctx.convert(Cst.field(node, "index"), this::convert),
            true,
            optional);
    }

    private AssignmentExpression assignment(TSNode node) {
        TSNode operator = Cst.field(node, "operator");
        String op = operator != null ? ctx.text(operator) : "=";
        return new AssignmentExpression(ctx.loc(node), op,
            ctx.convert(Cst.field(node, "left"), ctx.patterns()::assignmentTarget),
            ctx.convert(Cst.field(node, "right"), this::convert));
    }

    private UnaryExpression unary(TSNode node) {
        TSNode operator = Cst.field(node, "operator");
        return new UnaryExpression(ctx.loc(node),
            operator != null ? ctx.text(operator) : Cst.firstToken(node),
            true,
            ctx.convert(Cst.field(node, "argument"), this::convert));
    }

    private UpdateExpression update(TSNode node) {
        TSNode operator = Cst.field(node, "operator");
        TSNode argument = Cst.field(node, "argument");
        boolean prefix = operator != null && argument != null && operator.getStartByte() < argument.getStartByte();
        return new UpdateExpression(ctx.loc(node),
            operator != null ? ctx.text(operator) : Cst.firstToken(node),
            prefix,
            ctx.convert(argument, this::convert));
    }

    /**
     * Left-nested chains such as {@code a + b + c} are unrolled along their left spine, so long
     * concatenations in generated code do not recurse once per operand.
     */
    private Expression binary(TSNode node) {
        ArrayDeque<TSNode> spine = new ArrayDeque<>();
        TSNode current = node;
        while (current != null && "binary_expression".equals(current.getType())) {
            spine.push(current);
            current = Cst.field(current, "left");
        }
        Expression left = ctx.convert(current, this::convert);
        while (!spine.isEmpty()) {
            TSNode link = spine.pop();
            TSNode operator = Cst.field(link, "operator");
            String op = operator != null ? ctx.text(operator) : Cst.firstToken(link);
            Expression right = ctx.convert(Cst.field(link, "right"), this::convert);
            left = LOGICAL_OPERATORS.contains(op)
                ? new LogicalExpression(ctx.loc(link), op, left, right)
                : new BinaryExpression(ctx.loc(link), op, left, right);
        }
        return left;
    }

    private ConditionalExpression ternary(TSNode node) {
        return new ConditionalExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "condition"), this::convert),
            ctx.convert(Cst.field(node, "consequence"), this::convert),
            ctx.convert(Cst.field(node, "alternative"), this::convert));
    }

    private SequenceExpression sequence(TSNode node) {
        List<TSNode> operands = new ArrayList<>();
        flattenSequence(node, operands);
        return new SequenceExpression(ctx.loc(node), ctx.convertAll(operands, this::convert));
    }

    private void flattenSequence(TSNode node, List<TSNode> out) {
        ArrayDeque<TSNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            TSNode current = stack.pop();
            if (!"sequence_expression".equals(current.getType())) {
                out.add(current);
                continue;
            }
            List<TSNode> children = Cst.namedChildren(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    private Expression parenthesized(TSNode node) {
        TSNode inner = Cst.unwrapParens(node);
        if (inner == node) {
            return ctx.generic(NodeType.EXPRESSION, node);
        }
        return convert(inner);
    }

    private MetaProperty metaProperty(TSNode node) {
        String text = ctx.text(node);
        int dot = text.indexOf('.');
        if (dot < 0) {
            return new MetaProperty(ctx.loc(node), text.trim(), "");
        }
        return new MetaProperty(ctx.loc(node), text.substring(0, dot).trim(), text.substring(dot + 1).trim());
    }
}
