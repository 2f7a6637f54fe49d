package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

public record CallExpression(
    Expression callee,
    List<Expression> arguments,
    Position position
) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String type() {
        return "CallExpression";
    }

    @Override
    public String tokenLiteral() {
        return "(";
    }

    @Override
    public String render() {
        return callee.render() + arguments.stream().map(Node::render).collect(Collectors.joining(", ", "(", ")"));
    }
}
