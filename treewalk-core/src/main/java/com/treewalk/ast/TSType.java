package com.treewalk.ast;

public sealed interface TSType extends Node permits
    GenericNode,
    TSArrayType,
    TSIntersectionType,
    TSTypeReference,
    TSUnionType {
}
