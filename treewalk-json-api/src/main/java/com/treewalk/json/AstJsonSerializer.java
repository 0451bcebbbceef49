package com.treewalk.json;

import com.treewalk.ast.Node;

/**
 * Writes node trees as ESTree-shaped JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree to compact JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node and its subtree to indented JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
