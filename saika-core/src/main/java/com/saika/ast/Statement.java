package com.saika.ast;

public sealed interface Statement extends Node permits
    PackageStatement,
    ImportStatement,
    ImportGroup,
    FunctionStatement,
    VariableStatement,
    ReturnStatement,
    IfStatement,
    ForStatement,
    RangeStatement,
    BlockStatement,
    BreakStatement,
    ContinueStatement,
    StructType,
    ExpressionStatement {

    <R> R accept(StatementVisitor<R> visitor);
}
