package com.saika.ast;

public record BreakStatement(Position position) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }

    @Override
    public String tokenLiteral() {
        return "break";
    }

    @Override
    public String render() {
        return "break";
    }
}
