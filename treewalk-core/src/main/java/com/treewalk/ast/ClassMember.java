package com.treewalk.ast;

public sealed interface ClassMember extends Node permits
    GenericNode,
    MethodDefinition,
    PropertyDefinition,
    StaticBlock {
}
