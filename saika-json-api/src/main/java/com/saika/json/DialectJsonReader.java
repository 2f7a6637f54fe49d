package com.saika.json;

import com.saika.Dialect;

/**
 * Reads a {@link Dialect} from a JSON document of the form
 * <pre>{@code
 * {
 *   "extends": "defaults",
 *   "keywords": { "函數": "SAIKA_FUNCTION" },
 *   "typeNames": { "文字": "string" },
 *   "entryPointAliases": ["開始"]
 * }
 * }</pre>
 * Keyword values are {@link com.saika.TokenType} constant names. With {@code "extends":
 * "defaults"} the tables are layered over {@link Dialect#defaults()}; without it they replace
 * the built-in tables entirely.
 */
public interface DialectJsonReader {

    /**
     * @throws AstJsonException if the document is malformed or names an unknown token type
     */
    Dialect read(String json) throws AstJsonException;
}
