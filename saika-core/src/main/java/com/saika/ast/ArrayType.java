package com.saika.ast;

public record ArrayType(
    TypeExpression elementType,
    Position position
) implements TypeExpression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayType(this);
    }

    @Override
    public String type() {
        return "ArrayType";
    }

    @Override
    public String tokenLiteral() {
        return "[";
    }

    @Override
    public String render() {
        return "[]" + elementType.render();
    }
}
