package com.saika.ast;

public record BinaryExpression(
    String operator,
    Expression left,
    Expression right,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String type() {
        return "BinaryExpression";
    }

    @Override
    public String tokenLiteral() {
        return operator;
    }

    @Override
    public String render() {
        return "(" + left.render() + " " + operator + " " + right.render() + ")";
    }
}
