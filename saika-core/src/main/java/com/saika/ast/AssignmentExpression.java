package com.saika.ast;

/**
 * Plain or compound assignment ({@code =}, {@code +=}, ...). Right-associative.
 */
public record AssignmentExpression(
    String operator,
    Expression left,
    Expression right,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public String type() {
        return "AssignmentExpression";
    }

    @Override
    public String tokenLiteral() {
        return operator;
    }

    @Override
    public String render() {
        return left.render() + " " + operator + " " + right.render();
    }
}
