package com.saika.ast;

/**
 * A {@code let}/{@code var}/{@code const} declaration, or a short declaration
 * {@code name := value} (in which case {@code keyword} is {@code ":="}).
 */
public record VariableStatement(
    String keyword,
    Identifier name,
    TypeExpression declaredType,  // Can be null
    Expression value,             // Can be null
    boolean constant,
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String type() {
        return "VariableStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        StringBuilder out = new StringBuilder(constant ? "const " : "var ").append(name.name());
        if (declaredType != null) {
            out.append(' ').append(declaredType.render());
        }
        if (value != null) {
            out.append(" = ").append(value.render());
        }
        return out.toString();
    }
}
