package com.saika.ast;

/**
 * Base interface for all syntax tree nodes.
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression {

    /** Short kind name, used as the JSON discriminator and in diagnostics. */
    String type();

    /** Source text of the token that introduced this node. */
    String tokenLiteral();

    /** Compact source-like rendering, for debugging and test messages. */
    String render();

    Position position();
}
