package com.saika.ast;

public sealed interface Expression extends Node permits
    Identifier,
    IntegerLiteral,
    FloatLiteral,
    BooleanLiteral,
    StringLiteral,
    CharLiteral,
    ArrayLiteral,
    HashLiteral,
    UnaryExpression,
    BinaryExpression,
    AssignmentExpression,
    MemberExpression,
    IndexExpression,
    CallExpression,
    TypeExpression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
