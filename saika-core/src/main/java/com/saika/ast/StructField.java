package com.saika.ast;

public record StructField(
    String name,
    TypeExpression declaredType,
    Position position
) {
}
