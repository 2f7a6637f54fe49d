package com.saika.ast;

public record MemberExpression(
    Expression object,
    Identifier property,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public String tokenLiteral() {
        return ".";
    }

    @Override
    public String render() {
        return object.render() + "." + property.name();
    }
}
