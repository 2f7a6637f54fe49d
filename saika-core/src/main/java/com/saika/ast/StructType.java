package com.saika.ast;

import java.util.List;

/**
 * A struct type. With a name it is a top-level type declaration; without one it is an
 * anonymous struct used inline as a type. Fields keep their declaration order.
 */
public record StructType(
    Identifier name,  // Can be null
    List<StructField> fields,
    Position position
) implements Statement, TypeExpression {

    public StructType {
        fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStructType(this);
    }

    @Override
    public String type() {
        return "StructType";
    }

    @Override
    public String tokenLiteral() {
        return "struct";
    }

    @Override
    public String render() {
        StringBuilder out = new StringBuilder("struct ");
        if (name != null) {
            out.append(name.name()).append(' ');
        }
        out.append("{\n");
        for (StructField field : fields) {
            out.append('\t').append(field.name()).append(' ').append(field.declaredType().render()).append('\n');
        }
        return out.append('}').toString();
    }
}
