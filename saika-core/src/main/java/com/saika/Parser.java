package com.saika;

import com.saika.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent statement parser with a Pratt expression parser.
 *
 * <p>Syntax errors never throw. Each failing production records a {@link Diagnostic} and returns
 * {@link Optional#empty()}; the statement loop then resumes at the next token so the rest of the
 * file is still diagnosed.</p>
 */
public class Parser {
    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;           // Not an infix operator
    private static final int BP_LOWEST = 1;         // Minimum for a full expression
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, etc.) - right-associative
    private static final int BP_OR = 3;             // Logical OR (||)
    private static final int BP_AND = 4;            // Logical AND (&&)
    private static final int BP_EQUALITY = 5;       // Equality (==, !=)
    private static final int BP_RELATIONAL = 6;     // Relational (<, <=, >, >=)
    private static final int BP_BIT_OR = 7;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 8;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 9;        // Bitwise AND (&)
    private static final int BP_SHIFT = 10;         // Shift (<<, >>)
    private static final int BP_ADDITIVE = 11;      // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 12;// Multiplicative (*, /, %)
    private static final int BP_PREFIX = 13;        // Prefix unary (!, -, +, <-)
    private static final int BP_POSTFIX = 14;       // Postfix (x++, x--)
    private static final int BP_CALL = 15;          // Call f(x)
    private static final int BP_INDEX = 16;         // Index a[i]
    private static final int BP_MEMBER = 17;        // Member a.b

    private final List<Token> tokens;
    private final List<Diagnostic> lexicalWarnings;
    private final List<Diagnostic> errors = new ArrayList<>();
    private final String fileName;
    private int current = 0;

    public Parser(String source) {
        this(new Lexer(source));
    }

    public Parser(String source, String fileName) {
        this(new Lexer(source, fileName));
    }

    public Parser(String source, String fileName, Dialect dialect) {
        this(new Lexer(source, fileName, dialect));
    }

    public Parser(Lexer lexer) {
        this.tokens = lexer.tokenize();
        this.lexicalWarnings = List.copyOf(lexer.diagnostics());
        this.fileName = lexer.fileName();
    }

    /**
     * Parses an already scanned token sequence. A missing trailing EOF token is supplied.
     * No lexical warnings are attached; use {@link #Parser(List, List)} to carry them over.
     */
    public Parser(List<Token> tokens) {
        this(tokens, List.of());
    }

    /**
     * Parses an already scanned token sequence, keeping the warnings its lexer reported.
     */
    public Parser(List<Token> tokens, List<Diagnostic> lexicalWarnings) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || !copy.get(copy.size() - 1).is(TokenType.EOF)) {
            Position end = copy.isEmpty() ? new Position(1, 1) : copy.get(copy.size() - 1).position();
            copy.add(new Token(TokenType.EOF, "", end));
        }
        this.tokens = copy;
        this.lexicalWarnings = List.copyOf(lexicalWarnings);
        this.fileName = copy.get(0).position().file();
    }

    public static Program parse(String source) {
        return new Parser(source).parseProgram();
    }

    /** Syntax errors recorded so far, in the order they were found. */
    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** Warnings produced while scanning the input. */
    public List<Diagnostic> lexicalWarnings() {
        return lexicalWarnings;
    }

    public Program parseProgram() {
        List<Statement> statements = parseStatementsUntil(TokenType.EOF);
        return new Program(statements, new Position(1, 1, fileName));
    }

    private List<Statement> parseStatementsUntil(TokenType terminator) {
        List<Statement> statements = new ArrayList<>();
        while (!check(terminator) && !isAtEnd()) {
            int start = current;
            parseStatement().ifPresent(statements::add);
            if (current == start) {
                // failed without consuming anything: skip the offending token
                advance();
            }
        }
        return statements;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Optional<Statement> parseStatement() {
        Token token = peek();

        Optional<Statement> statement = switch (token.type()) {
            case PACKAGE -> parsePackageStatement();
            case IMPORT -> parseImportStatement();
            case FUNCTION, SAIKA_FUNCTION -> parseFunctionStatement();
            case LET, VAR, CONST -> parseVariableStatement();
            case RETURN -> parseReturnStatement();
            case IF -> parseIfStatement();
            case FOR -> parseForStatement();
            case STRUCT -> parseStructStatement();
            case TYPE -> parseTypeStatement();
            case BREAK -> Optional.of(new BreakStatement(advance().position()));
            case CONTINUE -> Optional.of(new ContinueStatement(advance().position()));
            case IDENT -> checkNext(TokenType.DEFINE) ? parseShortVariableStatement() : parseExpressionStatement();
            default -> parseExpressionStatement();
        };

        // statements are not required to be semicolon-terminated
        match(TokenType.SEMICOLON);
        return statement;
    }

    /**
     * A statement allowed in the init or post clause of a classic for loop. Unlike
     * {@link #parseStatement()} it leaves a following semicolon in place.
     */
    private Optional<Statement> parseSimpleStatement() {
        return switch (peek().type()) {
            case LET, VAR, CONST -> parseVariableStatement();
            case IDENT -> checkNext(TokenType.DEFINE) ? parseShortVariableStatement() : parseExpressionStatement();
            default -> parseExpressionStatement();
        };
    }

    private Optional<Statement> parsePackageStatement() {
        Token keyword = advance();
        Optional<Token> name = consume(TokenType.IDENT);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PackageStatement(keyword.literal(), name.get().literal(), keyword.position()));
    }

    private Optional<Statement> parseImportStatement() {
        Token keyword = advance();
        if (match(TokenType.LPAREN)) {
            List<ImportStatement> imports = new ArrayList<>();
            while (!check(TokenType.RPAREN)) {
                if (match(TokenType.SEMICOLON) || match(TokenType.COMMA)) {
                    continue;
                }
                Optional<ImportStatement> spec = parseImportSpec(keyword);
                if (spec.isEmpty()) {
                    return Optional.empty();
                }
                imports.add(spec.get());
            }
            advance(); // consume ')'
            return Optional.of(new ImportGroup(keyword.literal(), imports, keyword.position()));
        }
        return parseImportSpec(keyword).map(Statement.class::cast);
    }

    // [alias] "path" | identifier
    private Optional<ImportStatement> parseImportSpec(Token keyword) {
        Token start = peek();
        String alias = null;
        if (check(TokenType.IDENT) && checkNext(TokenType.STRING)) {
            alias = advance().literal();
        }
        if (alias == null && check(TokenType.IDENT)) {
            return Optional.of(new ImportStatement(keyword.literal(), null, advance().literal(), start.position()));
        }
        Optional<Token> path = consume(TokenType.STRING);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ImportStatement(keyword.literal(), alias, path.get().literal(), start.position()));
    }

    private Optional<Statement> parseFunctionStatement() {
        Token keyword = advance();

        Optional<Token> name = consume(TokenType.IDENT);
        if (name.isEmpty() || consume(TokenType.LPAREN).isEmpty()) {
            return Optional.empty();
        }

        List<Parameter> parameters = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            if (!check(TokenType.IDENT)) {
                expectedError(TokenType.RPAREN);
                return Optional.empty();
            }
            do {
                Optional<Parameter> parameter = parseParameter();
                if (parameter.isEmpty()) {
                    return Optional.empty();
                }
                parameters.add(parameter.get());
            } while (match(TokenType.COMMA));
        }
        if (consume(TokenType.RPAREN).isEmpty()) {
            return Optional.empty();
        }

        TypeExpression returnType = null;
        if (!check(TokenType.LBRACE)) {
            Optional<TypeExpression> parsed = parseType();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            returnType = parsed.get();
        }

        TypeExpression resultType = returnType;
        return parseBlockStatement().map(body -> new FunctionStatement(
            keyword.literal(), identifier(name.get()), parameters, resultType, body, keyword.position()));
    }

    private Optional<Parameter> parseParameter() {
        Optional<Token> name = consume(TokenType.IDENT);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        TypeExpression declaredType = null;
        if (!check(TokenType.COMMA) && !check(TokenType.RPAREN)) {
            Optional<TypeExpression> parsed = parseType();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            declaredType = parsed.get();
        }
        return Optional.of(new Parameter(identifier(name.get()), declaredType, name.get().position()));
    }

    private Optional<Statement> parseVariableStatement() {
        Token keyword = advance();
        boolean constant = keyword.is(TokenType.CONST);

        Optional<Token> name = consume(TokenType.IDENT);
        if (name.isEmpty()) {
            return Optional.empty();
        }

        TypeExpression declaredType = null;
        if (startsType(peek().type())) {
            Optional<TypeExpression> parsed = parseType();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            declaredType = parsed.get();
        }

        Expression value = null;
        if (match(TokenType.ASSIGN)) {
            Optional<Expression> parsed = parseExpression();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            value = parsed.get();
        }

        return Optional.of(new VariableStatement(
            keyword.literal(), identifier(name.get()), declaredType, value, constant, keyword.position()));
    }

    // name := value
    private Optional<Statement> parseShortVariableStatement() {
        Token name = advance();
        Token define = advance();
        return parseExpression().map(value -> new VariableStatement(
            define.literal(), identifier(name), null, value, false, name.position()));
    }

    private Optional<Statement> parseReturnStatement() {
        Token keyword = advance();
        if (check(TokenType.SEMICOLON) || check(TokenType.RBRACE) || isAtEnd()) {
            return Optional.of(new ReturnStatement(keyword.literal(), null, keyword.position()));
        }
        return parseExpression().map(value -> new ReturnStatement(keyword.literal(), value, keyword.position()));
    }

    private Optional<Statement> parseIfStatement() {
        Token keyword = advance();

        Optional<Expression> condition = parseExpression();
        if (condition.isEmpty()) {
            return Optional.empty();
        }
        Optional<BlockStatement> consequence = parseBlockStatement();
        if (consequence.isEmpty()) {
            return Optional.empty();
        }

        BlockStatement alternative = null;
        if (check(TokenType.ELSE)) {
            Token elseToken = advance();
            if (check(TokenType.IF)) {
                // else if: the nested if becomes the only statement of the alternative block
                Optional<Statement> nested = parseIfStatement();
                if (nested.isEmpty()) {
                    return Optional.empty();
                }
                alternative = new BlockStatement(List.of(nested.get()), elseToken.position());
            } else {
                Optional<BlockStatement> block = parseBlockStatement();
                if (block.isEmpty()) {
                    return Optional.empty();
                }
                alternative = block.get();
            }
        }

        return Optional.of(new IfStatement(
            keyword.literal(), condition.get(), consequence.get(), alternative, keyword.position()));
    }

    /**
     * Parses the four loop shapes that share the {@code for} keyword:
     * <ul>
     *   <li>{@code for key, value := range expr {}} and {@code for value := range expr {}}</li>
     *   <li>{@code for range expr {}}</li>
     *   <li>{@code for {}} (infinite) and {@code for cond {}} (condition only)</li>
     *   <li>{@code for init; cond; post {}}, each clause optional</li>
     * </ul>
     */
    private Optional<Statement> parseForStatement() {
        Token keyword = advance();

        if (check(TokenType.LBRACE)) {
            return parseBlockStatement().map(body ->
                new ForStatement(keyword.literal(), null, null, null, body, keyword.position()));
        }

        if (check(TokenType.RANGE)) {
            return parseRangeClause(keyword, null, null);
        }

        if (check(TokenType.IDENT) && checkNext(TokenType.COMMA)) {
            Identifier key = identifier(advance());
            advance(); // consume ','
            Optional<Token> value = consume(TokenType.IDENT);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            if (!check(TokenType.DEFINE) || !checkAhead(1, TokenType.RANGE)) {
                error("expected := range after range variables", peek().position());
                return Optional.empty();
            }
            advance(); // consume ':='
            return parseRangeClause(keyword, key, identifier(value.get()));
        }

        if (check(TokenType.IDENT) && checkNext(TokenType.DEFINE) && checkAhead(2, TokenType.RANGE)) {
            Identifier value = identifier(advance());
            advance(); // consume ':='
            return parseRangeClause(keyword, null, value);
        }

        Statement init = null;
        if (!check(TokenType.SEMICOLON)) {
            Optional<Statement> parsed = parseSimpleStatement();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            init = parsed.get();

            // for cond {}
            if (check(TokenType.LBRACE) && init instanceof ExpressionStatement conditionOnly) {
                return parseBlockStatement().map(body -> new ForStatement(
                    keyword.literal(), null, conditionOnly.expression(), null, body, keyword.position()));
            }
        }
        if (consume(TokenType.SEMICOLON).isEmpty()) {
            return Optional.empty();
        }

        Expression condition = null;
        if (!check(TokenType.SEMICOLON)) {
            Optional<Expression> parsed = parseExpression();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            condition = parsed.get();
        }
        if (consume(TokenType.SEMICOLON).isEmpty()) {
            return Optional.empty();
        }

        Statement post = null;
        if (!check(TokenType.LBRACE)) {
            Optional<Statement> parsed = parseSimpleStatement();
            if (parsed.isEmpty()) {
                return Optional.empty();
            }
            post = parsed.get();
        }

        Statement initClause = init;
        Expression conditionClause = condition;
        Statement postClause = post;
        return parseBlockStatement().map(body -> new ForStatement(
            keyword.literal(), initClause, conditionClause, postClause, body, keyword.position()));
    }

    // range expr { ... }, with the loop variables already consumed
    private Optional<Statement> parseRangeClause(Token keyword, Identifier key, Identifier value) {
        if (consume(TokenType.RANGE).isEmpty()) {
            return Optional.empty();
        }
        Optional<Expression> collection = parseExpression();
        if (collection.isEmpty()) {
            return Optional.empty();
        }
        return parseBlockStatement().map(body -> new RangeStatement(
            keyword.literal(), key, value, collection.get(), body, keyword.position()));
    }

    private Optional<BlockStatement> parseBlockStatement() {
        Optional<Token> open = consume(TokenType.LBRACE);
        if (open.isEmpty()) {
            return Optional.empty();
        }
        List<Statement> statements = parseStatementsUntil(TokenType.RBRACE);
        if (consume(TokenType.RBRACE).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BlockStatement(statements, open.get().position()));
    }

    // struct [Name] { field Type ... }
    private Optional<Statement> parseStructStatement() {
        Token keyword = advance();
        Identifier name = null;
        if (check(TokenType.IDENT)) {
            name = identifier(advance());
        }
        return parseStructBody(keyword, name).map(Statement.class::cast);
    }

    // type Name struct { ... }
    private Optional<Statement> parseTypeStatement() {
        Token keyword = advance();
        Optional<Token> name = consume(TokenType.IDENT);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (!check(TokenType.STRUCT)) {
            error("type declarations other than struct are not supported", keyword.position());
            return Optional.empty();
        }
        Token struct = advance();
        return parseStructBody(struct, identifier(name.get())).map(Statement.class::cast);
    }

    private Optional<StructType> parseStructBody(Token keyword, Identifier name) {
        if (consume(TokenType.LBRACE).isEmpty()) {
            return Optional.empty();
        }
        List<StructField> fields = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (match(TokenType.COMMA) || match(TokenType.SEMICOLON)) {
                continue;
            }
            if (!check(TokenType.IDENT)) {
                error("expected field name, got " + peek().type().display(), peek().position());
                return Optional.empty();
            }
            Token fieldName = advance();
            Optional<TypeExpression> fieldType = parseType();
            if (fieldType.isEmpty()) {
                return Optional.empty();
            }
            fields.add(new StructField(fieldName.literal(), fieldType.get(), fieldName.position()));
        }
        advance(); // consume '}'
        return Optional.of(new StructType(name, fields, keyword.position()));
    }

    private Optional<Statement> parseExpressionStatement() {
        Token start = peek();
        return parseExpression().map(expression -> new ExpressionStatement(expression, start.position()));
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static boolean startsType(TokenType type) {
        return type == TokenType.IDENT || type == TokenType.LBRACKET
            || type == TokenType.MAP || type == TokenType.STRUCT;
    }

    private Optional<TypeExpression> parseType() {
        Token token = peek();
        switch (token.type()) {
            case IDENT: {
                advance();
                return Optional.of(new NamedType(token.literal(), token.position()));
            }
            case LBRACKET: {
                advance();
                if (consume(TokenType.RBRACKET).isEmpty()) {
                    return Optional.empty();
                }
                return parseType().map(element -> new ArrayType(element, token.position()));
            }
            case MAP: {
                advance();
                if (consume(TokenType.LBRACKET).isEmpty()) {
                    return Optional.empty();
                }
                Optional<TypeExpression> key = parseType();
                if (key.isEmpty() || consume(TokenType.RBRACKET).isEmpty()) {
                    return Optional.empty();
                }
                return parseType().map(value -> new MapType(key.get(), value, token.position()));
            }
            case STRUCT: {
                advance();
                return parseStructBody(token, null).map(TypeExpression.class::cast);
            }
            default:
                expectedError(TokenType.IDENT);
                return Optional.empty();
        }
    }

    // ========================================================================
    // Expressions: Pratt parser
    // ========================================================================

    private Optional<Expression> parseExpression() {
        return parseExpr(BP_LOWEST);
    }

    /**
     * Parses an expression whose operators all bind tighter than {@code minBp}.
     */
    private Optional<Expression> parseExpr(int minBp) {
        Token token = peek();
        if (!hasPrefix(token.type())) {
            error("no prefix parse function for " + token.type().display() + " found", token.position());
            return Optional.empty();
        }
        advance();

        Optional<Expression> prefix = switch (token.type()) {
            case IDENT -> prefixIdentifier(this, token);
            case INT -> prefixInteger(this, token);
            case FLOAT -> prefixFloat(this, token);
            case STRING -> prefixString(this, token);
            case CHAR -> prefixChar(this, token);
            case TRUE, FALSE -> prefixBoolean(this, token);
            case LPAREN -> prefixGrouped(this, token);
            case LBRACKET -> prefixArray(this, token);
            case LBRACE -> prefixHash(this, token);
            case BANG, MINUS, PLUS, ARROW -> prefixUnary(this, token);
            default -> Optional.empty();
        };
        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        Expression left = prefix.get();

        while (!check(TokenType.SEMICOLON) && minBp < infixBindingPower(peek().type())) {
            Token op = advance();
            Optional<Expression> extended = switch (op.type()) {
                case LPAREN -> infixCall(this, left, op);
                case LBRACKET -> infixIndex(this, left, op);
                case DOT -> infixMember(this, left, op);
                case INCREMENT, DECREMENT -> infixPostfix(this, left, op);
                default -> op.type().isAssignment()
                    ? infixAssignment(this, left, op)
                    : infixBinary(this, left, op);
            };
            if (extended.isEmpty()) {
                return Optional.empty();
            }
            left = extended.get();
        }

        return Optional.of(left);
    }

    private static boolean hasPrefix(TokenType type) {
        return switch (type) {
            case IDENT, INT, FLOAT, STRING, CHAR, TRUE, FALSE,
                 LPAREN, LBRACKET, LBRACE, BANG, MINUS, PLUS, ARROW -> true;
            default -> false;
        };
    }

    private static int infixBindingPower(TokenType type) {
        return switch (type) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                 BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, SHL_ASSIGN, SHR_ASSIGN -> BP_ASSIGNMENT;
            case OR -> BP_OR;
            case AND -> BP_AND;
            case EQ, NOT_EQ -> BP_EQUALITY;
            case LT, LT_EQ, GT, GT_EQ -> BP_RELATIONAL;
            case BIT_OR -> BP_BIT_OR;
            case BIT_XOR -> BP_BIT_XOR;
            case BIT_AND -> BP_BIT_AND;
            case SHL, SHR -> BP_SHIFT;
            case PLUS, MINUS -> BP_ADDITIVE;
            case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
            case INCREMENT, DECREMENT -> BP_POSTFIX;
            case LPAREN -> BP_CALL;
            case LBRACKET -> BP_INDEX;
            case DOT -> BP_MEMBER;
            default -> BP_NONE;
        };
    }

    // ========================================================================
    // Prefix handlers
    // ========================================================================

    private static Optional<Expression> prefixIdentifier(Parser p, Token token) {
        return Optional.of(p.identifier(token));
    }

    private static Optional<Expression> prefixInteger(Parser p, Token token) {
        try {
            long value = parseIntegerLiteral(token.literal());
            return Optional.of(new IntegerLiteral(token.literal(), value, token.position()));
        } catch (NumberFormatException e) {
            p.error("could not parse " + token.literal() + " as integer", token.position());
            return Optional.empty();
        }
    }

    // a leading zero means octal: 010 is 8 and 09 is rejected
    private static long parseIntegerLiteral(String literal) {
        if (literal.length() > 1 && literal.charAt(0) == '0') {
            return Long.parseLong(literal.substring(1), 8);
        }
        return Long.parseLong(literal);
    }

    private static Optional<Expression> prefixFloat(Parser p, Token token) {
        try {
            double value = Double.parseDouble(token.literal());
            return Optional.of(new FloatLiteral(token.literal(), value, token.position()));
        } catch (NumberFormatException e) {
            p.error("could not parse " + token.literal() + " as float", token.position());
            return Optional.empty();
        }
    }

    private static Optional<Expression> prefixString(Parser p, Token token) {
        return Optional.of(new StringLiteral(token.literal(), token.position()));
    }

    private static Optional<Expression> prefixChar(Parser p, Token token) {
        return Optional.of(new CharLiteral(token.literal(), token.position()));
    }

    private static Optional<Expression> prefixBoolean(Parser p, Token token) {
        return Optional.of(new BooleanLiteral(token.literal(), token.is(TokenType.TRUE), token.position()));
    }

    private static Optional<Expression> prefixGrouped(Parser p, Token token) {
        Optional<Expression> inner = p.parseExpression();
        if (inner.isEmpty() || p.consume(TokenType.RPAREN).isEmpty()) {
            return Optional.empty();
        }
        return inner;
    }

    private static Optional<Expression> prefixArray(Parser p, Token token) {
        return p.parseExpressionList(TokenType.RBRACKET)
            .map(elements -> new ArrayLiteral(elements, token.position()));
    }

    private static Optional<Expression> prefixHash(Parser p, Token token) {
        List<HashLiteral.Pair> pairs = new ArrayList<>();
        while (!p.check(TokenType.RBRACE)) {
            Optional<Expression> key = p.parseExpression();
            if (key.isEmpty() || p.consume(TokenType.COLON).isEmpty()) {
                return Optional.empty();
            }
            Optional<Expression> value = p.parseExpression();
            if (value.isEmpty()) {
                return Optional.empty();
            }
            pairs.add(new HashLiteral.Pair(key.get(), value.get()));
            if (!p.check(TokenType.RBRACE) && p.consume(TokenType.COMMA).isEmpty()) {
                return Optional.empty();
            }
        }
        p.advance(); // consume '}'
        return Optional.of(new HashLiteral(pairs, token.position()));
    }

    private static Optional<Expression> prefixUnary(Parser p, Token token) {
        return p.parseExpr(BP_PREFIX)
            .map(operand -> new UnaryExpression(token.literal(), operand, false, token.position()));
    }

    // ========================================================================
    // Infix handlers
    // ========================================================================

    private static Optional<Expression> infixBinary(Parser p, Expression left, Token op) {
        // the operator's own binding power keeps a + b + c left-associative
        return p.parseExpr(infixBindingPower(op.type()))
            .map(right -> new BinaryExpression(op.literal(), left, right, left.position()));
    }

    private static Optional<Expression> infixAssignment(Parser p, Expression left, Token op) {
        // right-hand side at the lowest power so a = b = c nests to the right
        return p.parseExpr(BP_LOWEST)
            .map(right -> new AssignmentExpression(op.literal(), left, right, left.position()));
    }

    private static Optional<Expression> infixPostfix(Parser p, Expression left, Token op) {
        return Optional.of(new UnaryExpression(op.literal(), left, true, left.position()));
    }

    private static Optional<Expression> infixCall(Parser p, Expression left, Token op) {
        return p.parseExpressionList(TokenType.RPAREN)
            .map(arguments -> new CallExpression(left, arguments, left.position()));
    }

    private static Optional<Expression> infixIndex(Parser p, Expression left, Token op) {
        Optional<Expression> index = p.parseExpression();
        if (index.isEmpty() || p.consume(TokenType.RBRACKET).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IndexExpression(left, index.get(), left.position()));
    }

    private static Optional<Expression> infixMember(Parser p, Expression left, Token op) {
        return p.consume(TokenType.IDENT)
            .map(property -> new MemberExpression(left, p.identifier(property), left.position()));
    }

    // Comma-separated expressions up to and including the closing token
    private Optional<List<Expression>> parseExpressionList(TokenType close) {
        List<Expression> list = new ArrayList<>();
        if (match(close)) {
            return Optional.of(list);
        }
        do {
            if (check(close)) {
                break; // trailing comma
            }
            Optional<Expression> element = parseExpression();
            if (element.isEmpty()) {
                return Optional.empty();
            }
            list.add(element.get());
        } while (match(TokenType.COMMA));

        if (consume(close).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(list);
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private Identifier identifier(Token token) {
        return new Identifier(token.literal(), token.position());
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean checkNext(TokenType type) {
        return checkAhead(1, type);
    }

    private boolean checkAhead(int offset, TokenType type) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index).is(type);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token if it has the expected kind; otherwise records
     * "expected next token to be X, got Y" and leaves the position unchanged.
     */
    private Optional<Token> consume(TokenType type) {
        if (check(type)) {
            return Optional.of(advance());
        }
        expectedError(type);
        return Optional.empty();
    }

    private void expectedError(TokenType expected) {
        Token actual = peek();
        error("expected next token to be " + expected.display() + ", got " + actual.type().display(), actual.position());
    }

    private void error(String message, Position position) {
        errors.add(Diagnostic.error(message, position));
    }
}
