package com.treewalk.ast;

/**
 * Statements and declarations that may appear in a statement list.
 */
public sealed interface Statement extends Node permits
    BlockStatement,
    BreakStatement,
    ClassDeclaration,
    ContinueStatement,
    DebuggerStatement,
    DoWhileStatement,
    EmptyStatement,
    ExportAllDeclaration,
    ExportDefaultDeclaration,
    ExportNamedDeclaration,
    ExpressionStatement,
    ForInStatement,
    ForOfStatement,
    ForStatement,
    FunctionDeclaration,
    GenericNode,
    IfStatement,
    ImportDeclaration,
    LabeledStatement,
    ReturnStatement,
    SwitchStatement,
    TSEnumDeclaration,
    TSInterfaceDeclaration,
    TSTypeAliasDeclaration,
    ThrowStatement,
    TryStatement,
    VariableDeclaration,
    WhileStatement,
    WithStatement {
}
