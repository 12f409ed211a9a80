package com.svparser.json;

import com.svparser.ast.Node;

/**
 * Writes AST nodes as JSON. Every node carries its kind in a {@code "type"} property;
 * optional fields that are absent in the tree are absent in the JSON.
 */
public interface AstJsonSerializer {

    /**
     * @param node the node to serialize, usually the {@code Source} root
     * @return single-line JSON
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * @param node the node to serialize
     * @return indented JSON
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;
}
