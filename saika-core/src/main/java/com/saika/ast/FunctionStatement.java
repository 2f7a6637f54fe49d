package com.saika.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function declaration. {@code keyword} keeps the spelling used in the source
 * ({@code func} or {@code 數}); it has no effect on the generated code.
 */
public record FunctionStatement(
    String keyword,
    Identifier name,
    List<Parameter> parameters,
    TypeExpression returnType,  // Can be null
    BlockStatement body,
    Position position
) implements Statement {

    public FunctionStatement {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String type() {
        return "FunctionStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        String params = parameters.stream().map(Parameter::render).collect(Collectors.joining(", "));
        String result = returnType != null ? returnType.render() + " " : "";
        return keyword + " " + name.name() + "(" + params + ") " + result + body.render();
    }
}
