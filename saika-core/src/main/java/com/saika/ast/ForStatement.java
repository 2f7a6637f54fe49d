package com.saika.ast;

/**
 * Classic, condition-only and infinite loops; the three forms differ only in which of
 * {@code init}, {@code condition} and {@code post} are present.
 */
public record ForStatement(
    String keyword,
    Statement init,        // Can be null
    Expression condition,  // Can be null
    Statement post,        // Can be null
    BlockStatement body,
    Position position
) implements Statement {

    public boolean isClassic() {
        return init != null || post != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public String type() {
        return "ForStatement";
    }

    @Override
    public String tokenLiteral() {
        return keyword;
    }

    @Override
    public String render() {
        StringBuilder out = new StringBuilder("for ");
        if (isClassic()) {
            out.append(init != null ? init.render() : "").append("; ");
            out.append(condition != null ? condition.render() : "").append("; ");
            out.append(post != null ? post.render() : "").append(' ');
        } else if (condition != null) {
            out.append(condition.render()).append(' ');
        }
        return out.append(body.render()).toString();
    }
}
