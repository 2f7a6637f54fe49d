package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A map literal. Pairs are kept in source order so generated output is stable.
 */
public record HashLiteral(
    List<Pair> pairs,
    Position position
) implements Expression {

    public record Pair(Expression key, Expression value) {
    }

    public HashLiteral {
        pairs = List.copyOf(pairs);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitHash(this);
    }

    @Override
    public String type() {
        return "HashLiteral";
    }

    @Override
    public String tokenLiteral() {
        return "{";
    }

    @Override
    public String render() {
        return pairs.stream()
            .map(p -> p.key().render() + ": " + p.value().render())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
