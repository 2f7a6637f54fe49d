package com.saika.ast;

public record FloatLiteral(
    String literal,
    double value,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFloat(this);
    }

    @Override
    public String type() {
        return "FloatLiteral";
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
