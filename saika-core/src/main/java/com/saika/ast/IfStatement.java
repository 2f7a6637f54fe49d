package com.saika.ast;

public record IfStatement(
    String keyword,
    Expression condition,
    BlockStatement consequence,
    BlockStatement alternative,  // Can be null
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public String type() {
        return "IfStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        String out = "if " + condition.render() + " " + consequence.render();
        return alternative != null ? out + " else " + alternative.render() : out;
    }
}
