package com.saika.ast;

public interface ExpressionVisitor<R> {
    R visitIdentifier(Identifier node);
    R visitInteger(IntegerLiteral node);
    R visitFloat(FloatLiteral node);
    R visitBoolean(BooleanLiteral node);
    R visitString(StringLiteral node);
    R visitChar(CharLiteral node);
    R visitArray(ArrayLiteral node);
    R visitHash(HashLiteral node);
    R visitUnary(UnaryExpression node);
    R visitBinary(BinaryExpression node);
    R visitAssignment(AssignmentExpression node);
    R visitMember(MemberExpression node);
    R visitIndex(IndexExpression node);
    R visitCall(CallExpression node);

    // type expressions
    R visitNamedType(NamedType node);
    R visitArrayType(ArrayType node);
    R visitMapType(MapType node);
    R visitStructType(StructType node);
}
