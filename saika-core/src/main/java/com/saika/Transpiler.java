package com.saika;

import com.saika.ast.Program;
import com.saika.codegen.GoGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for callers that drive the pipeline: tokenize, parse, generate.
 *
 * <p>A {@code Transpiler} holds only its {@link Dialect}; every call builds a fresh lexer,
 * parser and generator, so one instance can serve concurrent calls on different inputs.</p>
 */
public class Transpiler {

    private static final Logger log = LoggerFactory.getLogger(Transpiler.class);

    private final Dialect dialect;

    public Transpiler() {
        this(Dialect.defaults());
    }

    public Transpiler(Dialect dialect) {
        this.dialect = dialect;
    }

    /**
     * A pull-based token stream over the source; call {@link Lexer#nextToken()} until EOF.
     */
    public Lexer tokenize(String source) {
        return tokenize(source, "");
    }

    public Lexer tokenize(String source, String fileName) {
        return new Lexer(source, fileName, dialect);
    }

    /**
     * Parses tokens scanned elsewhere. Warnings from that scan are not known here; callers
     * holding the {@link Lexer} should use {@link #parse(Lexer)}.
     */
    public ParseResult parse(List<Token> tokens) {
        return parse(tokens, List.of());
    }

    public ParseResult parse(List<Token> tokens, List<Diagnostic> lexicalWarnings) {
        Parser parser = new Parser(tokens, lexicalWarnings);
        Program program = parser.parseProgram();
        return new ParseResult(program, parser.lexicalWarnings(), parser.errors());
    }

    /**
     * Drains the lexer and parses the result, keeping its warnings.
     */
    public ParseResult parse(Lexer lexer) {
        List<Token> tokens = lexer.tokenize();
        return parse(tokens, lexer.diagnostics());
    }

    public ParseResult parse(String source, String fileName) {
        Parser parser = new Parser(tokenize(source, fileName));
        Program program = parser.parseProgram();
        log.debug("Parsed {}: {} top-level statements, {} errors",
            displayName(fileName), program.statements().size(), parser.errors().size());
        return new ParseResult(program, parser.lexicalWarnings(), parser.errors());
    }

    public GenerateResult generate(Program program) {
        GoGenerator generator = new GoGenerator(dialect);
        String output = generator.generate(program);
        return new GenerateResult(output, generator.errors());
    }

    public TranspileResult transpile(String source, String fileName) {
        log.debug("Transpiling {}", displayName(fileName));

        ParseResult parsed = parse(source, fileName);
        for (Diagnostic warning : parsed.lexicalWarnings()) {
            log.warn("{}", warning);
        }

        GenerateResult generated = generate(parsed.program());
        if (parsed.hasErrors() || generated.hasErrors()) {
            log.debug("{} finished with {} syntax and {} generation errors", displayName(fileName),
                parsed.errors().size(), generated.errors().size());
        }

        return new TranspileResult(fileName, generated.output(),
            parsed.lexicalWarnings(), parsed.errors(), generated.errors());
    }

    private static String displayName(String fileName) {
        return fileName == null || fileName.isEmpty() ? "<input>" : fileName;
    }
}
