package com.treewalk.ast;

/**
 * Members of an interface body or a type literal.
 */
public sealed interface TSSignature extends Node permits
    GenericNode,
    TSMethodSignature,
    TSPropertySignature {
}
