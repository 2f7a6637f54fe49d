package com.saika.ast;

public record ExpressionStatement(
    Expression expression,
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public String type() {
        return "ExpressionStatement";
    }

    @Override
    public String tokenLiteral() {
        return expression.tokenLiteral();
    }

    @Override
    public String render() {
        return expression.render();
    }
}
