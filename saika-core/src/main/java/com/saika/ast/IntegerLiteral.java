package com.saika.ast;

public record IntegerLiteral(
    String literal,
    long value,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitInteger(this);
    }

    @Override
    public String type() {
        return "IntegerLiteral";
    }

    @Override
    public String tokenLiteral() {
        return literal;
    }

    @Override
    public String render() {
        return literal;
    }
}
