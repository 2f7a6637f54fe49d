package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

public record ArrayLiteral(
    List<Expression> elements,
    Position position
) implements Expression {

    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String type() {
        return "ArrayLiteral";
    }

    @Override
    public String tokenLiteral() {
        return "[";
    }

    @Override
    public String render() {
        return elements.stream().map(Node::render).collect(Collectors.joining(", ", "[", "]"));
    }
}
