package com.saika.ast;

public record ContinueStatement(Position position) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public String type() {
        return "ContinueStatement";
    }

    @Override
    public String tokenLiteral() {
        return "continue";
    }

    @Override
    public String render() {
        return "continue";
    }
}
