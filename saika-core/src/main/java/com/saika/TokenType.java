package com.saika;

public enum TokenType {

    // special
    EOF("EOF"),
    ILLEGAL("ILLEGAL"),

    // identifiers and literals
    IDENT("IDENT"),
    INT("INT"),
    FLOAT("FLOAT"),
    STRING("STRING"),
    CHAR("CHAR"),

    // keywords
    PACKAGE("package"),
    IMPORT("import"),
    FUNCTION("func"),
    SAIKA_FUNCTION("數"),
    LET("let"),
    VAR("var"),
    CONST("const"),
    TRUE("true"),
    FALSE("false"),
    IF("if"),
    ELSE("else"),
    RETURN("return"),
    FOR("for"),
    RANGE("range"),
    BREAK("break"),
    CONTINUE("continue"),
    STRUCT("struct"),
    INTERFACE("interface"),
    MAP("map"),
    CHAN("chan"),
    GO("go"),
    SELECT("select"),
    SWITCH("switch"),
    CASE("case"),
    DEFAULT("default"),
    TYPE("type"),

    // arithmetic
    PLUS("+"), MINUS("-"), STAR("*"), SLASH("/"), PERCENT("%"),
    BANG("!"),

    // bitwise and shift
    BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"),
    SHL("<<"), SHR(">>"),

    // logical
    AND("&&"), OR("||"),

    // comparison
    EQ("=="), NOT_EQ("!="),
    LT("<"), LT_EQ("<="),
    GT(">"), GT_EQ(">="),

    // assignment
    ASSIGN("="), DEFINE(":="),
    PLUS_ASSIGN("+="), MINUS_ASSIGN("-="), STAR_ASSIGN("*="), SLASH_ASSIGN("/="), PERCENT_ASSIGN("%="),
    BIT_AND_ASSIGN("&="), BIT_OR_ASSIGN("|="), BIT_XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="), SHR_ASSIGN(">>="),

    // increment / decrement, channel arrow
    INCREMENT("++"), DECREMENT("--"),
    ARROW("<-"),

    // delimiters
    COMMA(","), SEMICOLON(";"), COLON(":"), DOT("."),
    LPAREN("("), RPAREN(")"),
    LBRACE("{"), RBRACE("}"),
    LBRACKET("["), RBRACKET("]");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * The text used for this kind in diagnostics: the lexeme for keywords and punctuation,
     * the kind name for literal classes.
     */
    public String display() {
        return display;
    }

    public boolean isAssignment() {
        return switch (this) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                 BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, SHL_ASSIGN, SHR_ASSIGN -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return display;
    }
}
