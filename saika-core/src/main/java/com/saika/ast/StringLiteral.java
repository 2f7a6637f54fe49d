package com.saika.ast;

/**
 * A string literal. {@code value} is the raw text between the quotes with escape sequences
 * left as written.
 */
public record StringLiteral(
    String value,
    Position position
) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String type() {
        return "StringLiteral";
    }

    @Override
    public String tokenLiteral() {
        return "\"" + value + "\"";
    }

    @Override
    public String render() {
        return "\"" + value + "\"";
    }
}
