package com.saika;

import com.saika.ast.Program;

import java.util.List;

/**
 * A (possibly partial) program together with the problems found while producing it.
 */
public record ParseResult(
    Program program,
    List<Diagnostic> lexicalWarnings,
    List<Diagnostic> errors
) {

    public ParseResult {
        lexicalWarnings = List.copyOf(lexicalWarnings);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
