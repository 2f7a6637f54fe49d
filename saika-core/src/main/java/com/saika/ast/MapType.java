package com.saika.ast;

public record MapType(
    TypeExpression keyType,
    TypeExpression valueType,
    Position position
) implements TypeExpression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMapType(this);
    }

    @Override
    public String type() {
        return "MapType";
    }

    @Override
    public String tokenLiteral() {
        return "map";
    }

    @Override
    public String render() {
        return "map[" + keyType.render() + "]" + valueType.render();
    }
}
