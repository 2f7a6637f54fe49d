package com.saika.ast;

/**
 * An expression that names a type. Only type positions (parameters, results, variable and
 * field declarations) produce these.
 */
public sealed interface TypeExpression extends Expression permits
    NamedType,
    ArrayType,
    MapType,
    StructType {
}
