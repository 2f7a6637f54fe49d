package com.saika.ast;

public record ReturnStatement(
    String keyword,
    Expression value,  // Can be null
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        return value != null ? "return " + value.render() : "return";
    }
}
