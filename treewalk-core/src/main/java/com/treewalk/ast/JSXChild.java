package com.treewalk.ast;

public sealed interface JSXChild extends Node permits
    GenericNode,
    JSXElement,
    JSXExpressionContainer,
    JSXFragment,
    JSXSpreadChild,
    JSXText {
}
