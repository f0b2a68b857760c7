package com.jsdesugar.json;

import com.jsdesugar.ast.Node;

/**
 * Writes AST nodes as ESTree JSON, the hand-off format for emitters that run
 * outside the JVM.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node to a JSON string.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @param node the AST node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
