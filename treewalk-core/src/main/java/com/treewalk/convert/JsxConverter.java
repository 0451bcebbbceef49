package com.treewalk.convert;

import com.treewalk.ast.Expression;
import com.treewalk.ast.JSXAttribute;
import com.treewalk.ast.JSXChild;
import com.treewalk.ast.JSXClosingElement;
import com.treewalk.ast.JSXElement;
import com.treewalk.ast.JSXEmptyExpression;
import com.treewalk.ast.JSXExpressionContainer;
import com.treewalk.ast.JSXFragment;
import com.treewalk.ast.JSXIdentifier;
import com.treewalk.ast.JSXMemberExpression;
import com.treewalk.ast.JSXOpeningElement;
import com.treewalk.ast.JSXSpreadAttribute;
import com.treewalk.ast.JSXSpreadChild;
import com.treewalk.ast.JSXText;
import com.treewalk.ast.Node;
import com.treewalk.ast.NodeType;
import com.treewalk.ast.SourceLocation;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JSX elements, fragments, attributes, names, text and expression containers.
 * Namespaced names such as {@code svg:rect} become a single {@link JSXIdentifier}.
 */
final class JsxConverter {

    private final ConversionContext ctx;

    JsxConverter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    Expression element(TSNode node) {
        return switch (node.getType()) {
            case "jsx_element" -> isFragment(node) ? fragment(node) : jsxElement(node);
            case "jsx_self_closing_element" -> selfClosing(node);
            case "jsx_fragment" -> fragment(node);
            default -> ctx.generic(NodeType.EXPRESSION, node);
        };
    }

    private JSXChild child(TSNode node) {
        return switch (node.getType()) {
            case "jsx_text", "html_character_reference" -> {
                String text = ctx.text(node);
                yield new JSXText(ctx.loc(node), text, text);
            }
            case "jsx_element" -> isFragment(node) ? fragment(node) : jsxElement(node);
            case "jsx_self_closing_element" -> selfClosing(node);
            case "jsx_fragment" -> fragment(node);
            case "jsx_expression" -> {
                TSNode inner = Cst.firstNamed(node);
                if (inner != null && "spread_element".equals(inner.getType())) {
                    yield new JSXSpreadChild(ctx.loc(node),
                        ctx.convert(Cst.firstNamed(inner), ctx.expressions()::convert));
                }
                yield container(node);
            }
            default -> ctx.generic(NodeType.UNKNOWN, node);
        };
    }

    /**
     * {@code <>...</>}: an element whose opening tag has no name.
     */
    private boolean isFragment(TSNode node) {
        TSNode open = Cst.field(node, "open_tag");
        return open != null && Cst.field(open, "name") == null;
    }

    private JSXElement jsxElement(TSNode node) {
        TSNode open = Cst.field(node, "open_tag");
        TSNode close = Cst.field(node, "close_tag");
        JSXOpeningElement opening = ctx.convert(open, n -> openingElement(n, false));
        JSXClosingElement closing = ctx.convert(close,
            n -> new JSXClosingElement(ctx.loc(n), ctx.convert(Cst.field(n, "name"), this::name)));
        return new JSXElement(ctx.loc(node), opening, children(node), closing);
    }

    private JSXElement selfClosing(TSNode node) {
        return new JSXElement(ctx.loc(node), openingElement(node, true), List.of(), null);
    }

    private JSXFragment fragment(TSNode node) {
        return new JSXFragment(ctx.loc(node), children(node));
    }

    private JSXOpeningElement openingElement(TSNode node, boolean selfClosing) {
        TSNode nameNode = Cst.field(node, "name");
        List<TSNode> attributes = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            if (nameNode == null || child.getStartByte() != nameNode.getStartByte()) {
                attributes.add(child);
            }
        }
        return new JSXOpeningElement(ctx.loc(node),
            ctx.convert(nameNode, this::name),
            ctx.convertAll(attributes, this::attribute),
            selfClosing);
    }

    private List<JSXChild> children(TSNode node) {
        List<TSNode> items = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            String type = child.getType();
            if (!"jsx_opening_element".equals(type) && !"jsx_closing_element".equals(type)) {
                items.add(child);
            }
        }
        return ctx.convertAll(items, this::child);
    }

    private Node attribute(TSNode node) {
        if ("jsx_expression".equals(node.getType())) {
            TSNode spread = Cst.firstOfType(node, "spread_element");
            TSNode argument = spread != null ? Cst.firstNamed(spread) : Cst.firstNamed(node);
            return new JSXSpreadAttribute(ctx.loc(node), ctx.convert(argument, ctx.expressions()::convert));
        }
        if (!"jsx_attribute".equals(node.getType())) {
            return ctx.generic(NodeType.UNKNOWN, node);
        }
        List<TSNode> parts = Cst.namedChildren(node);
        Node name = parts.isEmpty() ? null : ctx.convert(parts.get(0), this::name);
        Node value = parts.size() < 2 ? null : ctx.convert(parts.get(1), this::attributeValue);
        return new JSXAttribute(ctx.loc(node), name, value);
    }

    private Node attributeValue(TSNode node) {
        return switch (node.getType()) {
            case "string" -> ctx.expressions().literal(node);
            case "jsx_expression" -> container(node);
            case "jsx_element", "jsx_self_closing_element", "jsx_fragment" -> element(node);
            default -> ctx.generic(NodeType.UNKNOWN, node);
        };
    }

    private JSXExpressionContainer container(TSNode node) {
        TSNode inner = Cst.firstNamed(node);
        if (inner == null) {
            SourceLocation loc = ctx.loc(node.getStartByte() + 1, Math.max(node.getStartByte() + 1, node.getEndByte() - 1));
            return new JSXExpressionContainer(ctx.loc(node), new JSXEmptyExpression(loc));
        }
        return new JSXExpressionContainer(ctx.loc(node), ctx.convert(inner, ctx.expressions()::convert));
    }

    /**
     * Element or attribute name: an identifier, a dotted member name or a namespaced name.
     */
    Node name(TSNode node) {
        return switch (node.getType()) {
            case "member_expression", "nested_identifier" -> {
                List<TSNode> parts = Cst.namedChildren(node);
                TSNode object = Cst.field(node, "object");
                TSNode property = Cst.field(node, "property");
                if (object == null && parts.size() >= 2) {
                    object = parts.get(0);
                    property = parts.get(parts.size() - 1);
                }
                yield new JSXMemberExpression(ctx.loc(node),
                    ctx.convert(object, this::name),
                    ctx.convert(property, n -> new JSXIdentifier(ctx.loc(n), ctx.text(n))));
            }
            default -> new JSXIdentifier(ctx.loc(node), ctx.text(node));
        };
    }
}
