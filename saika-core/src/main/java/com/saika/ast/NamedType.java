package com.saika.ast;

/**
 * A type referenced by name, such as {@code int} or {@code 整數}. The name is kept as
 * written; translation to a Go type name happens during generation.
 */
public record NamedType(
    String name,
    Position position
) implements TypeExpression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNamedType(this);
    }

    @Override
    public String type() {
        return "NamedType";
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
