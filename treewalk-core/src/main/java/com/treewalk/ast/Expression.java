package com.treewalk.ast;

public sealed interface Expression extends Node permits
    ArrayExpression,
    ArrowFunctionExpression,
    AssignmentExpression,
    AwaitExpression,
    BinaryExpression,
    CallExpression,
    ClassExpression,
    ConditionalExpression,
    FunctionExpression,
    GenericNode,
    Identifier,
    ImportExpression,
    JSXElement,
    JSXFragment,
    Literal,
    LogicalExpression,
    MemberExpression,
    MetaProperty,
    NewExpression,
    ObjectExpression,
    PrivateIdentifier,
    SequenceExpression,
    Super,
    TaggedTemplateExpression,
    TemplateLiteral,
    ThisExpression,
    UnaryExpression,
    UpdateExpression,
    YieldExpression {
}
