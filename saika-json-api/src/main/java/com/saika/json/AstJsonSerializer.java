package com.saika.json;

import com.saika.ast.Node;

/**
 * Writes syntax trees as JSON. Every node object carries a {@code "type"} member naming its
 * kind, so the output can be read back by an {@link AstJsonDeserializer}.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same as {@link #serialize(Node)} but indented for reading.
     *
     * @throws AstJsonException if the node cannot be written
     */
    String serializePretty(Node node) throws AstJsonException;
}
