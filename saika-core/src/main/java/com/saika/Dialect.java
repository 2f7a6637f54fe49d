package com.saika;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * The surface vocabulary of a Saika source file: which spellings are keywords, which type
 * names translate to Go built-ins, and which function names denote the program entry point.
 *
 * <p>{@link #defaults()} carries the English keywords plus the traditional Chinese aliases.
 * A dialect with an entirely different keyword table can be built with {@link #of} or read
 * from JSON through the Jackson module.</p>
 */
public record Dialect(
    Map<String, TokenType> keywords,
    Map<String, String> typeNames,
    Set<String> entryPointAliases
) {

    /** Name Go requires for the program entry point. */
    public static final String ENTRY_POINT = "main";

    private static final Map<String, TokenType> BASE_KEYWORDS = Map.ofEntries(
        Map.entry("package", TokenType.PACKAGE),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("func", TokenType.FUNCTION),
        Map.entry("let", TokenType.LET),
        Map.entry("var", TokenType.VAR),
        Map.entry("const", TokenType.CONST),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("return", TokenType.RETURN),
        Map.entry("for", TokenType.FOR),
        Map.entry("range", TokenType.RANGE),
        Map.entry("break", TokenType.BREAK),
        Map.entry("continue", TokenType.CONTINUE),
        Map.entry("struct", TokenType.STRUCT),
        Map.entry("interface", TokenType.INTERFACE),
        Map.entry("map", TokenType.MAP),
        Map.entry("chan", TokenType.CHAN),
        Map.entry("go", TokenType.GO),
        Map.entry("select", TokenType.SELECT),
        Map.entry("switch", TokenType.SWITCH),
        Map.entry("case", TokenType.CASE),
        Map.entry("default", TokenType.DEFAULT),
        Map.entry("type", TokenType.TYPE)
    );

    private static final Map<String, TokenType> CHINESE_KEYWORDS = Map.ofEntries(
        Map.entry("數", TokenType.SAIKA_FUNCTION),
        Map.entry("包", TokenType.PACKAGE),
        Map.entry("導入", TokenType.IMPORT),
        Map.entry("變", TokenType.LET),
        Map.entry("常", TokenType.CONST),
        Map.entry("若", TokenType.IF),
        Map.entry("否則", TokenType.ELSE),
        Map.entry("返回", TokenType.RETURN),
        Map.entry("為", TokenType.FOR),
        Map.entry("真", TokenType.TRUE),
        Map.entry("假", TokenType.FALSE)
    );

    private static final Map<String, String> CHINESE_TYPE_NAMES = Map.of(
        "整數", "int",
        "浮點", "float64",
        "字串", "string",
        "布林", "bool",
        "字元", "rune",
        "位元組", "byte"
    );

    private static final Dialect DEFAULTS;

    static {
        Map<String, TokenType> keywords = new HashMap<>(BASE_KEYWORDS);
        keywords.putAll(CHINESE_KEYWORDS);
        DEFAULTS = new Dialect(keywords, CHINESE_TYPE_NAMES, Set.of("主"));
    }

    public Dialect {
        keywords = Map.copyOf(keywords);
        typeNames = Map.copyOf(typeNames);
        entryPointAliases = Set.copyOf(entryPointAliases);
    }

    public static Dialect defaults() {
        return DEFAULTS;
    }

    public static Dialect of(Map<String, TokenType> keywords, Map<String, String> typeNames, Set<String> entryPointAliases) {
        return new Dialect(keywords, typeNames, entryPointAliases);
    }

    /**
     * Keyword kind for the given text, or {@link TokenType#IDENT} when it is not a keyword.
     */
    public TokenType lookupIdent(String text) {
        return keywords.getOrDefault(text, TokenType.IDENT);
    }

    /**
     * Go spelling of a surface type name; names absent from the table pass through unchanged.
     */
    public String translateType(String name) {
        return typeNames.getOrDefault(name, name);
    }

    /**
     * Go spelling of a function name, rewriting entry-point aliases to {@value #ENTRY_POINT}.
     */
    public String translateFunctionName(String name) {
        return entryPointAliases.contains(name) ? ENTRY_POINT : name;
    }

    /**
     * A copy of this dialect with additional keyword spellings layered over the existing table.
     */
    public Dialect withKeywords(Map<String, TokenType> extra) {
        Map<String, TokenType> merged = new HashMap<>(keywords);
        merged.putAll(extra);
        return new Dialect(merged, typeNames, entryPointAliases);
    }
}
