package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parenthesised import block: {@code import ( "fmt"; "os" )}.
 */
public record ImportGroup(
    String keyword,
    List<ImportStatement> imports,
    Position position
) implements Statement {

    public ImportGroup {
        imports = List.copyOf(imports);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImportGroup(this);
    }

    @Override
    public String type() {
        return "ImportGroup";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        return imports.stream()
            .map(i -> i.render().substring("import ".length()))
            .collect(Collectors.joining("; ", "import (", ")"));
    }
}
