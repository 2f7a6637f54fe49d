package com.saika;

import com.saika.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parseClean(String source) {
        Parser parser = new Parser(source);
        Program program = parser.parseProgram();
        assertEquals(List.of(), parser.errors(), "unexpected syntax errors for: " + source);
        return program;
    }

    private static Expression parseExpression(String source) {
        Program program = parseClean(source);
        assertEquals(1, program.statements().size());
        ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, program.statements().get(0));
        return statement.expression();
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
        "a + b + c           => ((a + b) + c)",
        "a - b * c           => (a - (b * c))",
        "a * b + c / d       => ((a * b) + (c / d))",
        "a || b && c         => (a || (b && c))",
        "a == b < c          => (a == (b < c))",
        "a | b ^ c & d        => (a | (b ^ (c & d)))",
        "a << 1 + 2          => (a << (1 + 2))",
        "-a + b              => ((-a) + b)",
        "!a == b             => ((!a) == b)",
        "(a + b) * c         => ((a + b) * c)",
        "a < b == c > d      => ((a < b) == (c > d))"
    })
    void testOperatorPrecedence(String source, String expected) {
        assertEquals(expected, parseExpression(source).render());
    }

    @Test
    void testAssignmentIsRightAssociative() {
        AssignmentExpression outer = assertInstanceOf(AssignmentExpression.class, parseExpression("a = b = c"));
        assertEquals("a", outer.left().render());
        AssignmentExpression inner = assertInstanceOf(AssignmentExpression.class, outer.right());
        assertEquals("b", inner.left().render());
        assertEquals("c", inner.right().render());
    }

    @Test
    void testCompoundAssignmentTakesWholeRightSide() {
        AssignmentExpression assignment = assertInstanceOf(AssignmentExpression.class, parseExpression("x += y * 2"));
        assertEquals("+=", assignment.operator());
        assertEquals("(y * 2)", assignment.right().render());
    }

    @Test
    void testPostfixChainsLeftToRight() {
        IndexExpression index = assertInstanceOf(IndexExpression.class, parseExpression("a.b(c)[d]"));
        CallExpression call = assertInstanceOf(CallExpression.class, index.base());
        MemberExpression member = assertInstanceOf(MemberExpression.class, call.callee());
        assertEquals("a", member.object().render());
        assertEquals("b", member.property().name());
        assertEquals(List.of("c"), call.arguments().stream().map(Node::render).toList());
    }

    @Test
    void testPostfixIncrement() {
        UnaryExpression increment = assertInstanceOf(UnaryExpression.class, parseExpression("i++"));
        assertTrue(increment.postfix());
        assertEquals("++", increment.operator());
    }

    @Test
    void testLiterals() {
        ArrayLiteral array = assertInstanceOf(ArrayLiteral.class, parseExpression("[1, 2.5, \"s\", 'c', true, 假]"));
        assertEquals(6, array.elements().size());
        assertEquals(1L, assertInstanceOf(IntegerLiteral.class, array.elements().get(0)).value());
        assertEquals(2.5, assertInstanceOf(FloatLiteral.class, array.elements().get(1)).value());
        assertEquals("s", assertInstanceOf(StringLiteral.class, array.elements().get(2)).value());
        assertEquals("c", assertInstanceOf(CharLiteral.class, array.elements().get(3)).value());
        assertTrue(assertInstanceOf(BooleanLiteral.class, array.elements().get(4)).value());
        assertFalse(assertInstanceOf(BooleanLiteral.class, array.elements().get(5)).value());
    }

    @Test
    void testLeadingZeroIntegerIsOctal() {
        IntegerLiteral octal = assertInstanceOf(IntegerLiteral.class, parseExpression("010"));
        assertEquals(8L, octal.value());
        assertEquals("010", octal.render());
        assertEquals(0L, assertInstanceOf(IntegerLiteral.class, parseExpression("0")).value());
        assertEquals(511L, assertInstanceOf(IntegerLiteral.class, parseExpression("0777")).value());
    }

    @Test
    void testInvalidOctalDigitIsReported() {
        Parser parser = new Parser("let y = 09\nlet z = 1");
        Program program = parser.parseProgram();
        assertEquals(1, parser.errors().size());
        assertEquals("could not parse 09 as integer", parser.errors().get(0).message());
        assertEquals(new Position(1, 9), parser.errors().get(0).position());
        assertTrue(program.statements().stream()
            .anyMatch(s -> s instanceof VariableStatement v && v.name().name().equals("z")));
    }

    @Test
    void testHashLiteralKeepsSourceOrder() {
        HashLiteral hash = assertInstanceOf(HashLiteral.class, parseExpression("{\"z\": 1, \"a\": 2, \"m\": 3,}"));
        assertEquals(List.of("\"z\"", "\"a\"", "\"m\""),
            hash.pairs().stream().map(pair -> pair.key().render()).toList());
    }

    @Test
    void testLetStatement() {
        Program program = parseClean("let x = 1 + 2 * 3");
        VariableStatement let = assertInstanceOf(VariableStatement.class, program.statements().get(0));
        assertEquals("x", let.name().name());
        assertFalse(let.constant());
        assertNull(let.declaredType());
        assertEquals("(1 + (2 * 3))", let.value().render());
    }

    @Test
    void testTypedConstWithoutSemicolons() {
        Program program = parseClean("const limit 整數 = 10\nvar names []string");
        VariableStatement limit = assertInstanceOf(VariableStatement.class, program.statements().get(0));
        assertTrue(limit.constant());
        assertEquals("整數", limit.declaredType().render());

        VariableStatement names = assertInstanceOf(VariableStatement.class, program.statements().get(1));
        assertInstanceOf(ArrayType.class, names.declaredType());
        assertNull(names.value());
    }

    @Test
    void testShortVariableDeclaration() {
        Program program = parseClean("x := f(1);");
        VariableStatement statement = assertInstanceOf(VariableStatement.class, program.statements().get(0));
        assertEquals(":=", statement.keyword());
        assertEquals("f(1)", statement.value().render());
    }

    @Test
    void testFunctionWithParametersAndReturnType() {
        Program program = parseClean("func add(a int, b map[string]int) int { return a + b }");
        FunctionStatement function = assertInstanceOf(FunctionStatement.class, program.statements().get(0));
        assertEquals("add", function.name().name());
        assertEquals(2, function.parameters().size());
        assertEquals("int", function.parameters().get(0).declaredType().render());
        assertInstanceOf(MapType.class, function.parameters().get(1).declaredType());
        assertEquals("int", function.returnType().render());

        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, function.body().statements().get(0));
        assertEquals("(a + b)", ret.value().render());
    }

    @Test
    void testFunctionKeywordSpellingIsKept() {
        Program program = parseClean("數 f() {}");
        FunctionStatement function = assertInstanceOf(FunctionStatement.class, program.statements().get(0));
        assertEquals("數", function.keyword());
    }

    @Test
    void testUntypedParameters() {
        FunctionStatement function = assertInstanceOf(FunctionStatement.class,
            parseClean("func f(a, b) {}").statements().get(0));
        assertNull(function.parameters().get(0).declaredType());
        assertNull(function.parameters().get(1).declaredType());
    }

    @Test
    void testIfElseIf() {
        IfStatement statement = assertInstanceOf(IfStatement.class,
            parseClean("if a { x } else if b { y } else { z }").statements().get(0));
        IfStatement nested = assertInstanceOf(IfStatement.class, statement.alternative().statements().get(0));
        assertEquals("b", nested.condition().render());
        assertNotNull(nested.alternative());
    }

    @Test
    void testClassicForLoop() {
        ForStatement loop = assertInstanceOf(ForStatement.class,
            parseClean("for i := 0; i < 10; i++ { }").statements().get(0));
        VariableStatement init = assertInstanceOf(VariableStatement.class, loop.init());
        assertEquals("i", init.name().name());
        assertEquals("(i < 10)", loop.condition().render());
        ExpressionStatement post = assertInstanceOf(ExpressionStatement.class, loop.post());
        assertTrue(assertInstanceOf(UnaryExpression.class, post.expression()).postfix());
        assertTrue(loop.body().statements().isEmpty());
    }

    @Test
    void testForLoopWithEmptyClauses() {
        ForStatement loop = assertInstanceOf(ForStatement.class, parseClean("for ; ; { }").statements().get(0));
        assertNull(loop.init());
        assertNull(loop.condition());
        assertNull(loop.post());
    }

    @Test
    void testInfiniteAndConditionOnlyLoops() {
        Program program = parseClean("for { break }\nfor x < 3 { continue }");
        ForStatement infinite = assertInstanceOf(ForStatement.class, program.statements().get(0));
        assertNull(infinite.condition());
        assertInstanceOf(BreakStatement.class, infinite.body().statements().get(0));

        ForStatement conditional = assertInstanceOf(ForStatement.class, program.statements().get(1));
        assertNull(conditional.init());
        assertEquals("(x < 3)", conditional.condition().render());
        assertInstanceOf(ContinueStatement.class, conditional.body().statements().get(0));
    }

    @Test
    void testRangeForms() {
        Program program = parseClean("for k, v := range m {}\nfor v := range xs {}\nfor range ch {}");

        RangeStatement both = assertInstanceOf(RangeStatement.class, program.statements().get(0));
        assertEquals("k", both.key().name());
        assertEquals("v", both.value().name());
        assertEquals("m", both.collection().render());

        RangeStatement valueOnly = assertInstanceOf(RangeStatement.class, program.statements().get(1));
        assertNull(valueOnly.key());
        assertEquals("v", valueOnly.value().name());

        RangeStatement bare = assertInstanceOf(RangeStatement.class, program.statements().get(2));
        assertNull(bare.key());
        assertNull(bare.value());
    }

    @Test
    void testRangeVariablesWithoutDefine() {
        Parser parser = new Parser("for a, b range xs {}");
        parser.parseProgram();
        assertEquals("expected := range after range variables", parser.errors().get(0).message());
    }

    @Test
    void testStructDeclarations() {
        Program program = parseClean("struct Point { x int, y int }\ntype Person struct {\n name 字串\n tags []string\n}");

        StructType point = assertInstanceOf(StructType.class, program.statements().get(0));
        assertEquals("Point", point.name().name());
        assertEquals(List.of("x", "y"), point.fields().stream().map(StructField::name).toList());

        StructType person = assertInstanceOf(StructType.class, program.statements().get(1));
        assertEquals("Person", person.name().name());
        assertEquals("字串", person.fields().get(0).declaredType().render());
        assertInstanceOf(ArrayType.class, person.fields().get(1).declaredType());
    }

    @Test
    void testInlineStructType() {
        VariableStatement variable = assertInstanceOf(VariableStatement.class,
            parseClean("var p struct { x int }").statements().get(0));
        StructType struct = assertInstanceOf(StructType.class, variable.declaredType());
        assertNull(struct.name());
    }

    @Test
    void testStructFieldMustBeNamed() {
        Parser parser = new Parser("struct { 1 int }");
        parser.parseProgram();
        assertEquals("expected field name, got INT", parser.errors().get(0).message());
    }

    @Test
    void testNonStructTypeDeclarationIsRejected() {
        Parser parser = new Parser("type Celsius float64");
        parser.parseProgram();
        assertEquals("type declarations other than struct are not supported", parser.errors().get(0).message());
    }

    @Test
    void testImports() {
        Program program = parseClean("package main\nimport \"fmt\"\nimport str \"strings\"\nimport (\n\"os\"\nio \"io\"\n)");
        assertEquals("main", assertInstanceOf(PackageStatement.class, program.statements().get(0)).name());

        ImportStatement fmt = assertInstanceOf(ImportStatement.class, program.statements().get(1));
        assertEquals("fmt", fmt.path());
        assertNull(fmt.alias());

        ImportStatement strings = assertInstanceOf(ImportStatement.class, program.statements().get(2));
        assertEquals("str", strings.alias());

        ImportGroup group = assertInstanceOf(ImportGroup.class, program.statements().get(3));
        assertEquals(2, group.imports().size());
        assertEquals("io", group.imports().get(1).alias());
    }

    @Test
    void testMissingParenthesisIsReportedAndParsingContinues() {
        Parser parser = new Parser("數 main( { }\n數 other() { }", "bad.saika");
        Program program = parser.parseProgram();

        assertFalse(parser.errors().isEmpty());
        Diagnostic first = parser.errors().get(0);
        assertEquals("expected next token to be ), got {", first.message());
        assertEquals(1, first.position().line());
        assertEquals(9, first.position().column());
        assertTrue(first.isError());

        assertTrue(program.statements().stream()
            .anyMatch(s -> s instanceof FunctionStatement f && f.name().name().equals("other")));
    }

    @Test
    void testNoPrefixParseFunction() {
        Parser parser = new Parser("let x = )\nlet y = 2");
        Program program = parser.parseProgram();
        assertEquals("no prefix parse function for ) found", parser.errors().get(0).message());
        assertTrue(program.statements().stream()
            .anyMatch(s -> s instanceof VariableStatement v && v.name().name().equals("y")));
    }

    @Test
    void testErrorsInsideBlockDoNotEscapeIt() {
        Parser parser = new Parser("func f() { let = 1 }\nfunc g() {}");
        Program program = parser.parseProgram();
        assertEquals("expected next token to be IDENT, got =", parser.errors().get(0).message());
        assertTrue(program.statements().stream()
            .anyMatch(s -> s instanceof FunctionStatement f && f.name().name().equals("g")));
    }

    @Test
    void testParseFromTokenList() {
        List<Token> tokens = new Lexer("x = 1").tokenize();
        Parser parser = new Parser(tokens.subList(0, tokens.size() - 1));
        Program program = parser.parseProgram();
        assertEquals(1, program.statements().size());
        assertTrue(parser.errors().isEmpty());
    }

    @Test
    void testTokenListParseKeepsLexerWarnings() {
        Lexer lexer = new Lexer("let s = \"open");
        List<Token> tokens = lexer.tokenize();

        Parser parser = new Parser(tokens, lexer.diagnostics());
        parser.parseProgram();
        assertEquals(lexer.diagnostics(), parser.lexicalWarnings());
        assertEquals(List.of(), new Parser(tokens).lexicalWarnings());
    }

    @Test
    void testLexicalWarningsAreExposed() {
        Parser parser = new Parser("let s = \"open");
        parser.parseProgram();
        assertEquals(1, parser.lexicalWarnings().size());
        assertTrue(parser.errors().isEmpty());
    }
}
