package com.saika;

import com.saika.ast.Position;

public record Token(TokenType type, String literal, Position position) {

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    public boolean is(TokenType other) {
        return type == other;
    }
}
