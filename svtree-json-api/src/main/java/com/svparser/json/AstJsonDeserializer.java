package com.svparser.json;

import com.svparser.ast.Node;
import com.svparser.ast.Source;

/**
 * Reads AST nodes back from the JSON produced by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @param json JSON of a {@code Source} root
     * @return the tree
     * @throws AstJsonException if the JSON is malformed or not a Source
     */
    Source deserializeSource(String json) throws AstJsonException;

    /**
     * @param json JSON of a single node
     * @param type expected node class
     * @param <T>  node type
     * @return the node
     * @throws AstJsonException if the JSON is malformed or of another kind
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
