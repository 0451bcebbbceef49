package com.treewalk.ast;

import java.util.List;

/**
 * What a node holds under one {@link ChildRole}: nothing, one child, or an ordered list.
 */
public sealed interface ChildSlot {

    Empty EMPTY = new Empty();

    List<Node> nodes();

    default boolean isEmpty() {
        return nodes().isEmpty();
    }

    static ChildSlot empty() {
        return EMPTY;
    }

    static ChildSlot of(Node node) {
        return node == null ? EMPTY : new One(node);
    }

    static ChildSlot of(List<? extends Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return EMPTY;
        }
        return new Many(List.copyOf(nodes));
    }

    record Empty() implements ChildSlot {
        @Override
        public List<Node> nodes() {
            return List.of();
        }
    }

    record One(Node node) implements ChildSlot {
        @Override
        public List<Node> nodes() {
            return List.of(node);
        }
    }

    record Many(List<Node> nodes) implements ChildSlot {
    }
}
