package com.treewalk.ast;

import com.treewalk.source.SourceText;
import com.treewalk.source.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Base interface for all AST nodes.
 *
 * <p>Every node carries its UTF-8 byte range {@code [start, end)} and the 1-indexed lines of both
 * ends. Children are discovered through {@link #slot(ChildRole)}, so generic code never needs to
 * switch on the concrete kind.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    Pattern,
    TSType,
    JSXChild,
    ClassMember,
    TSSignature,
    CatchClause,
    ClassBody,
    Decorator,
    ExportSpecifier,
    ImportDefaultSpecifier,
    ImportNamespaceSpecifier,
    ImportSpecifier,
    JSXAttribute,
    JSXClosingElement,
    JSXEmptyExpression,
    JSXIdentifier,
    JSXMemberExpression,
    JSXOpeningElement,
    JSXSpreadAttribute,
    Property,
    SpreadElement,
    SwitchCase,
    TSEnumMember,
    TSInterfaceBody,
    TSInterfaceHeritage,
    TSTypeAnnotation,
    TSTypeParameter,
    TSTypeParameterDeclaration,
    TSTypeParameterInstantiation,
    TemplateElement,
    VariableDeclarator {

    String type();
    int start();
    int end();
    int startLine();
    int endLine();

    default SourceLocation loc() {
        return new SourceLocation(start(), end(), startLine(), endLine());
    }

    default Span span() {
        return new Span(start(), end());
    }

    default LineRange lineRange() {
        return new LineRange(startLine(), endLine());
    }

    default String text(SourceText source) {
        return source.textOf(start(), end());
    }

    default String text(String source) {
        return SourceText.slice(source, start(), end());
    }

    /**
     * Children held under {@code role}. Kinds without such a field answer an empty slot.
     */
    default ChildSlot slot(ChildRole role) {
        return ChildSlot.empty();
    }

    /**
     * All direct children in source order; children starting at the same offset keep
     * {@link ChildRole} declaration order.
     */
    default List<Node> childNodes() {
        List<Node> children = new ArrayList<>();
        for (ChildRole role : ChildRole.values()) {
            children.addAll(slot(role).nodes());
        }
        children.sort(Comparator.comparingInt(Node::start));
        return children;
    }
}
