package com.saika.jackson;

import com.saika.Dialect;
import com.saika.TokenType;
import com.saika.Transpiler;
import com.saika.json.AstJsonException;
import com.saika.json.AstJsonProvider;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonDialectReaderTest {

    private final JacksonDialectReader reader = new JacksonDialectReader();

    @Test
    void testLayeredDialect() {
        Dialect dialect = reader.read("""
            {
              "extends": "defaults",
              "keywords": { "函數": "SAIKA_FUNCTION", "回": "RETURN" },
              "typeNames": { "文字": "string" },
              "entryPointAliases": ["開始"]
            }
            """);

        assertEquals(TokenType.SAIKA_FUNCTION, dialect.lookupIdent("函數"));
        assertEquals(TokenType.SAIKA_FUNCTION, dialect.lookupIdent("數"));
        assertEquals("string", dialect.translateType("文字"));
        assertEquals("int", dialect.translateType("整數"));
        assertEquals("main", dialect.translateFunctionName("開始"));
        assertEquals("main", dialect.translateFunctionName("主"));

        String go = new Transpiler(dialect).transpile("函數 開始(s 文字) 文字 { 回 s }", "").requireSuccess();
        assertEquals("func main(s string) string {\n\treturn s\n}\n", go);
    }

    @Test
    void testStandaloneDialectReplacesDefaults() {
        Dialect dialect = reader.read("""
            { "keywords": { "fn": "FUNCTION" }, "entryPointAliases": ["start"] }
            """);

        assertEquals(TokenType.FUNCTION, dialect.lookupIdent("fn"));
        assertEquals(TokenType.IDENT, dialect.lookupIdent("func"));
        assertEquals(TokenType.IDENT, dialect.lookupIdent("數"));
        assertTrue(dialect.typeNames().isEmpty());
        assertEquals(Set.of("start"), dialect.entryPointAliases());
    }

    @Test
    void testHandWrittenDialectMayHaveCommentsAndTrailingCommas() {
        Dialect dialect = reader.read("""
            {
              // layered over the built-in tables
              "extends": "defaults",
              "keywords": {
                "迴圈": "FOR", /* loop keyword */
              },
              "entryPointAliases": ["起點",],
            }
            """);

        assertEquals(TokenType.FOR, dialect.lookupIdent("迴圈"));
        assertEquals("main", dialect.translateFunctionName("起點"));
    }

    @Test
    void testProviderExposesReader() {
        Dialect dialect = AstJsonProvider.getProvider().getDialectReader().read("{\"extends\": \"defaults\"}");
        assertEquals(Dialect.defaults(), dialect);
    }

    @Test
    void testUnknownTokenType() {
        AstJsonException e = assertThrows(AstJsonException.class,
            () -> reader.read("{\"keywords\": {\"當\": \"WHILE\"}}"));
        assertEquals("Unknown token type 'WHILE' for keyword '當'", e.getMessage());
    }

    @Test
    void testDocumentMustBeObject() {
        assertThrows(AstJsonException.class, () -> reader.read("[1, 2]"));
        assertThrows(AstJsonException.class, () -> reader.read("{broken"));
    }
}
