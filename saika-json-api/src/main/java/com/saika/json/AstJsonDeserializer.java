package com.saika.json;

import com.saika.ast.Node;
import com.saika.ast.Program;

/**
 * Reads syntax trees back from the JSON produced by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole program.
     *
     * @throws AstJsonException if the JSON is malformed or names an unknown node type
     */
    Program deserializeProgram(String json) throws AstJsonException;

    /**
     * Reads a single node of the given kind, e.g. {@code Statement.class} or
     * {@code BinaryExpression.class}.
     *
     * @throws AstJsonException if the JSON is malformed or does not describe a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
