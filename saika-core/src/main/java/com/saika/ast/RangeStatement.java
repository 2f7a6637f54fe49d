package com.saika.ast;

public record RangeStatement(
    String keyword,
    Identifier key,    // Can be null
    Identifier value,  // Can be null
    Expression collection,
    BlockStatement body,
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public String type() {
        return "RangeStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        StringBuilder out = new StringBuilder("for ");
        if (key != null && value != null) {
            out.append(key.name()).append(", ").append(value.name()).append(" := ");
        } else if (key != null || value != null) {
            out.append((key != null ? key : value).name()).append(" := ");
        }
        return out.append("range ").append(collection.render()).append(' ').append(body.render()).toString();
    }
}
