package com.saika.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.saika.ast.*;

/**
 * Polymorphic type handling for the syntax tree: every node is written with a {@code "type"}
 * member holding the record's simple name, which is also what {@link Node#type()} returns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Program.class, name = "Program"),

    // statements
    @JsonSubTypes.Type(value = PackageStatement.class, name = "PackageStatement"),
    @JsonSubTypes.Type(value = ImportStatement.class, name = "ImportStatement"),
    @JsonSubTypes.Type(value = ImportGroup.class, name = "ImportGroup"),
    @JsonSubTypes.Type(value = FunctionStatement.class, name = "FunctionStatement"),
    @JsonSubTypes.Type(value = VariableStatement.class, name = "VariableStatement"),
    @JsonSubTypes.Type(value = ReturnStatement.class, name = "ReturnStatement"),
    @JsonSubTypes.Type(value = IfStatement.class, name = "IfStatement"),
    @JsonSubTypes.Type(value = ForStatement.class, name = "ForStatement"),
    @JsonSubTypes.Type(value = RangeStatement.class, name = "RangeStatement"),
    @JsonSubTypes.Type(value = BlockStatement.class, name = "BlockStatement"),
    @JsonSubTypes.Type(value = BreakStatement.class, name = "BreakStatement"),
    @JsonSubTypes.Type(value = ContinueStatement.class, name = "ContinueStatement"),
    @JsonSubTypes.Type(value = ExpressionStatement.class, name = "ExpressionStatement"),

    // expressions
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = IntegerLiteral.class, name = "IntegerLiteral"),
    @JsonSubTypes.Type(value = FloatLiteral.class, name = "FloatLiteral"),
    @JsonSubTypes.Type(value = BooleanLiteral.class, name = "BooleanLiteral"),
    @JsonSubTypes.Type(value = StringLiteral.class, name = "StringLiteral"),
    @JsonSubTypes.Type(value = CharLiteral.class, name = "CharLiteral"),
    @JsonSubTypes.Type(value = ArrayLiteral.class, name = "ArrayLiteral"),
    @JsonSubTypes.Type(value = HashLiteral.class, name = "HashLiteral"),
    @JsonSubTypes.Type(value = UnaryExpression.class, name = "UnaryExpression"),
    @JsonSubTypes.Type(value = BinaryExpression.class, name = "BinaryExpression"),
    @JsonSubTypes.Type(value = AssignmentExpression.class, name = "AssignmentExpression"),
    @JsonSubTypes.Type(value = MemberExpression.class, name = "MemberExpression"),
    @JsonSubTypes.Type(value = IndexExpression.class, name = "IndexExpression"),
    @JsonSubTypes.Type(value = CallExpression.class, name = "CallExpression"),

    // types (StructType is both a statement and a type)
    @JsonSubTypes.Type(value = NamedType.class, name = "NamedType"),
    @JsonSubTypes.Type(value = ArrayType.class, name = "ArrayType"),
    @JsonSubTypes.Type(value = MapType.class, name = "MapType"),
    @JsonSubTypes.Type(value = StructType.class, name = "StructType")
})
public abstract class NodeMixin {
}
