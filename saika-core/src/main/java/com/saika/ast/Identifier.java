package com.saika.ast;

public record Identifier(
    String name,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String type() {
        return "Identifier";
    }

    @Override
    public String tokenLiteral() {
        return name;
    }

    @Override
    public String render() {
        return name;
    }
}
