package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Root of the tree: the top-level statements of one source file, in source order.
 */
public record Program(
    List<Statement> statements,
    Position position
) implements Node {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public String type() {
        return "Program";
    }

    @Override
    public String tokenLiteral() {
        return statements.isEmpty() ? "" : statements.get(0).tokenLiteral();
    }

    @Override
    public String render() {
        return statements.stream().map(Node::render).collect(Collectors.joining("\n"));
    }
}
