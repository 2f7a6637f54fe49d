package com.saika.ast;

public record UnaryExpression(
    String operator,
    Expression operand,
    boolean postfix,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String type() {
        return "UnaryExpression";
    }

    @Override
    public String tokenLiteral() {
        return operator;
    }

    @Override
    public String render() {
        return postfix ? operand.render() + operator : "(" + operator + operand.render() + ")";
    }
}
