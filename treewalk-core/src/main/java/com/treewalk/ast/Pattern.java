package com.treewalk.ast;

/**
 * Binding and assignment targets. Destructuring patterns are only available as generic nodes.
 */
public sealed interface Pattern extends Node permits
    AssignmentPattern,
    GenericNode,
    Identifier,
    MemberExpression,
    RestElement {
}
