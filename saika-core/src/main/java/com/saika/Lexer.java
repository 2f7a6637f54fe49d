package com.saika;

import com.saika.ast.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pull-based tokenizer over the code points of a Saika source string.
 *
 * <p>{@link #nextToken()} can be called repeatedly; once the input is exhausted it keeps
 * returning {@link TokenType#EOF}. Lexical problems never stop the stream: they are recorded
 * as warnings in {@link #diagnostics()} and the offending text is returned as a token (marked
 * {@link TokenType#ILLEGAL} when it cannot be used at all).</p>
 */
public class Lexer {

    private static final int EOF_CHAR = -1;

    private final int[] input;
    private final String fileName;
    private final Dialect dialect;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int position = -1; // index of ch in input
    private int ch = EOF_CHAR;
    private int line = 1;
    private int column = 0;

    public Lexer(String source) {
        this(source, "");
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, Dialect.defaults());
    }

    public Lexer(String source, String fileName, Dialect dialect) {
        this.input = source.codePoints().toArray();
        this.fileName = fileName == null ? "" : fileName;
        this.dialect = dialect;
        readChar();
    }

    public String fileName() {
        return fileName;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Drains the stream. The returned list always ends with exactly one EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    public Token nextToken() {
        skipWhitespace();
        Position start = here();

        switch (ch) {
            case EOF_CHAR:
                return new Token(TokenType.EOF, "", start);
            case '=':
                return peekChar() == '=' ? pair(TokenType.EQ, start) : single(TokenType.ASSIGN, start);
            case '+':
                if (peekChar() == '=') return pair(TokenType.PLUS_ASSIGN, start);
                if (peekChar() == '+') return pair(TokenType.INCREMENT, start);
                return single(TokenType.PLUS, start);
            case '-':
                if (peekChar() == '=') return pair(TokenType.MINUS_ASSIGN, start);
                if (peekChar() == '-') return pair(TokenType.DECREMENT, start);
                return single(TokenType.MINUS, start);
            case '!':
                return peekChar() == '=' ? pair(TokenType.NOT_EQ, start) : single(TokenType.BANG, start);
            case '*':
                return peekChar() == '=' ? pair(TokenType.STAR_ASSIGN, start) : single(TokenType.STAR, start);
            case '/':
                if (peekChar() == '/') {
                    skipLineComment();
                    return nextToken();
                }
                if (peekChar() == '*') {
                    skipBlockComment(start);
                    return nextToken();
                }
                return peekChar() == '=' ? pair(TokenType.SLASH_ASSIGN, start) : single(TokenType.SLASH, start);
            case '%':
                return peekChar() == '=' ? pair(TokenType.PERCENT_ASSIGN, start) : single(TokenType.PERCENT, start);
            case '&':
                if (peekChar() == '=') return pair(TokenType.BIT_AND_ASSIGN, start);
                if (peekChar() == '&') return pair(TokenType.AND, start);
                return single(TokenType.BIT_AND, start);
            case '|':
                if (peekChar() == '=') return pair(TokenType.BIT_OR_ASSIGN, start);
                if (peekChar() == '|') return pair(TokenType.OR, start);
                return single(TokenType.BIT_OR, start);
            case '^':
                return peekChar() == '=' ? pair(TokenType.BIT_XOR_ASSIGN, start) : single(TokenType.BIT_XOR, start);
            case '<':
                if (peekChar() == '=') return pair(TokenType.LT_EQ, start);
                if (peekChar() == '-') return pair(TokenType.ARROW, start);
                if (peekChar() == '<') {
                    return peekChar(2) == '=' ? triple(TokenType.SHL_ASSIGN, start) : pair(TokenType.SHL, start);
                }
                return single(TokenType.LT, start);
            case '>':
                if (peekChar() == '=') return pair(TokenType.GT_EQ, start);
                if (peekChar() == '>') {
                    return peekChar(2) == '=' ? triple(TokenType.SHR_ASSIGN, start) : pair(TokenType.SHR, start);
                }
                return single(TokenType.GT, start);
            case ':':
                return peekChar() == '=' ? pair(TokenType.DEFINE, start) : single(TokenType.COLON, start);
            case '.':
                return single(TokenType.DOT, start);
            case ',':
                return single(TokenType.COMMA, start);
            case ';':
                return single(TokenType.SEMICOLON, start);
            case '(':
                return single(TokenType.LPAREN, start);
            case ')':
                return single(TokenType.RPAREN, start);
            case '{':
                return single(TokenType.LBRACE, start);
            case '}':
                return single(TokenType.RBRACE, start);
            case '[':
                return single(TokenType.LBRACKET, start);
            case ']':
                return single(TokenType.RBRACKET, start);
            case '"':
                return readString(start);
            case '\'':
                return readCharLiteral(start);
            default:
                if (isLetter(ch)) {
                    String text = readIdentifier();
                    return new Token(dialect.lookupIdent(text), text, start);
                }
                if (isAsciiDigit(ch)) {
                    return readNumber(start);
                }
                return single(TokenType.ILLEGAL, start);
        }
    }

    // ================= scanners =================

    private String readIdentifier() {
        StringBuilder sb = new StringBuilder();
        while (isLetter(ch) || Character.isDigit(ch)) {
            sb.appendCodePoint(ch);
            readChar();
        }
        return sb.toString();
    }

    private Token readNumber(Position start) {
        StringBuilder sb = new StringBuilder();
        boolean isFloat = false;

        appendDigits(sb);

        if (ch == '.' && isAsciiDigit(peekChar())) {
            isFloat = true;
            sb.appendCodePoint(ch);
            readChar();
            appendDigits(sb);
        }

        // exponent: 1e10, 1.5e-5
        if ((ch == 'e' || ch == 'E') && (isAsciiDigit(peekChar())
                || ((peekChar() == '+' || peekChar() == '-') && isAsciiDigit(peekChar(2))))) {
            isFloat = true;
            sb.appendCodePoint(ch);
            readChar();
            if (ch == '+' || ch == '-') {
                sb.appendCodePoint(ch);
                readChar();
            }
            appendDigits(sb);
        }

        // 123abc is one malformed literal, not a number followed by a name
        boolean malformed = false;
        while (isLetter(ch) || Character.isDigit(ch)) {
            malformed = true;
            sb.appendCodePoint(ch);
            readChar();
        }

        String literal = sb.toString();
        if (malformed || !isValidNumber(literal, isFloat)) {
            warn("invalid numeric literal '" + literal + "'", start);
            return new Token(TokenType.ILLEGAL, literal, start);
        }
        return new Token(isFloat ? TokenType.FLOAT : TokenType.INT, literal, start);
    }

    private static boolean isValidNumber(String literal, boolean isFloat) {
        try {
            if (isFloat) {
                return Double.isFinite(Double.parseDouble(literal));
            }
            if (literal.length() > 1 && literal.charAt(0) == '0') {
                // octal digits and range are checked when the literal is parsed
                return true;
            }
            Long.parseLong(literal);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private void appendDigits(StringBuilder sb) {
        while (isAsciiDigit(ch)) {
            sb.appendCodePoint(ch);
            readChar();
        }
    }

    /**
     * Scans a double-quoted string. The literal keeps escape sequences as written so the
     * generator can emit them unchanged.
     */
    private Token readString(Position start) {
        readChar(); // opening "
        StringBuilder sb = new StringBuilder();

        while (true) {
            if (ch == '"') {
                readChar();
                break;
            }
            if (ch == EOF_CHAR) {
                warn("unterminated string literal", start);
                break;
            }
            if (ch == '\\') {
                Position escape = here();
                sb.appendCodePoint(ch);
                readChar();
                if (ch == EOF_CHAR) {
                    warn("unterminated string literal", start);
                    break;
                }
                checkEscape(escape);
            }
            sb.appendCodePoint(ch);
            readChar();
        }

        return new Token(TokenType.STRING, sb.toString(), start);
    }

    private Token readCharLiteral(Position start) {
        readChar(); // opening '
        StringBuilder sb = new StringBuilder();

        if (ch == '\\') {
            Position escape = here();
            sb.appendCodePoint(ch);
            readChar();
            if (ch != EOF_CHAR) {
                checkEscape(escape);
                sb.appendCodePoint(ch);
                readChar();
            }
        } else if (ch != EOF_CHAR && ch != '\'') {
            sb.appendCodePoint(ch);
            readChar();
        }

        if (ch == '\'') {
            readChar();
        } else {
            warn("unterminated character literal", start);
        }
        return new Token(TokenType.CHAR, sb.toString(), start);
    }

    // ch is the character after the backslash at the given position
    private void checkEscape(Position escape) {
        switch (ch) {
            case 'n', 'r', 't', '\\', '"', '\'' -> { }
            default -> warn("unknown escape sequence \\" + Character.toString(ch), escape);
        }
    }

    private void skipWhitespace() {
        while (ch != EOF_CHAR && (Character.isWhitespace(ch) || Character.isSpaceChar(ch))) {
            readChar();
        }
    }

    private void skipLineComment() {
        while (ch != '\n' && ch != EOF_CHAR) {
            readChar();
        }
    }

    private void skipBlockComment(Position start) {
        readChar(); // /
        readChar(); // *
        while (true) {
            if (ch == EOF_CHAR) {
                warn("unterminated block comment", start);
                return;
            }
            if (ch == '*' && peekChar() == '/') {
                readChar();
                readChar();
                return;
            }
            readChar();
        }
    }

    // ================= helpers =================

    private void readChar() {
        if (position < input.length) {
            position++;
        }
        ch = position < input.length ? input[position] : EOF_CHAR;
        if (ch == '\n') {
            line++;
            column = 0;
        } else if (ch != EOF_CHAR) {
            column++;
        }
    }

    private int peekChar() {
        return peekChar(1);
    }

    private int peekChar(int n) {
        int index = position + n;
        return index < input.length ? input[index] : EOF_CHAR;
    }

    private Token single(TokenType type, Position start) {
        String literal = Character.toString(ch);
        readChar();
        return new Token(type, literal, start);
    }

    private Token pair(TokenType type, Position start) {
        StringBuilder sb = new StringBuilder().appendCodePoint(ch);
        readChar();
        sb.appendCodePoint(ch);
        readChar();
        return new Token(type, sb.toString(), start);
    }

    private Token triple(TokenType type, Position start) {
        StringBuilder sb = new StringBuilder().appendCodePoint(ch);
        readChar();
        sb.appendCodePoint(ch);
        readChar();
        sb.appendCodePoint(ch);
        readChar();
        return new Token(type, sb.toString(), start);
    }

    private Position here() {
        return new Position(line, column, fileName);
    }

    private void warn(String message, Position position) {
        diagnostics.add(Diagnostic.warning(message, position));
    }

    private static boolean isLetter(int c) {
        return c != EOF_CHAR && (Character.isLetter(c) || c == '_');
    }

    private static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
