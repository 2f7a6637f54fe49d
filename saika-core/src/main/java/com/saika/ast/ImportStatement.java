package com.saika.ast;

/**
 * A single import. {@code path} is the text between the quotes.
 */
public record ImportStatement(
    String keyword,
    String alias,  // Can be null
    String path,
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImport(this);
    }

    @Override
    public String type() {
        return "ImportStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        return alias != null ? "import " + alias + " \"" + path + "\"" : "import \"" + path + "\"";
    }
}
