package com.saika.ast;

public record PackageStatement(
    String keyword,
    String name,
    Position position
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPackage(this);
    }

    @Override
    public String type() {
        return "PackageStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        return "package " + name;
    }
}
