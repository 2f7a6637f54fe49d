package com.saika.ast;

public record CharLiteral(
    String value,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitChar(this);
    }

    @Override
    public String type() {
        return "CharLiteral";
    }

    @Override
    public String tokenLiteral() {
        return "'" + value + "'";
    }

    @Override
    public String render() {
        return "'" + value + "'";
    }
}
