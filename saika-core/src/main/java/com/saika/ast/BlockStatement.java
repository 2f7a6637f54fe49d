package com.saika.ast;

import java.util.List;

public record BlockStatement(
    List<Statement> statements,
    Position position
) implements Statement {

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String type() {
        return "BlockStatement";
    }

    @Override
    public String tokenLiteral() {
        return "{";
    }

    @Override
    public String render() {
        StringBuilder out = new StringBuilder("{\n");
        for (Statement statement : statements) {
            out.append(statement.render()).append('\n');
        }
        return out.append('}').toString();
    }
}
