package com.saika.ast;

public record BooleanLiteral(
    String literal,
    boolean value,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String type() {
        return "BooleanLiteral";
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
