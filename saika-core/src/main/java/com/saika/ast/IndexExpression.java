package com.saika.ast;

public record IndexExpression(
    Expression base,
    Expression index,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public String type() {
        return "IndexExpression";
    }

    @Override
    public String tokenLiteral() {
        return "[";
    }

    @Override
    public String render() {
        return base.render() + "[" + index.render() + "]";
    }
}
