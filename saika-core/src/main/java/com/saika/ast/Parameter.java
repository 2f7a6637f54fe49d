package com.saika.ast;

public record Parameter(
    Identifier name,
    TypeExpression declaredType,  // Can be null
    Position position
) {

    public String render() {
        return declaredType != null ? name.name() + " " + declaredType.render() : name.name();
    }
}
