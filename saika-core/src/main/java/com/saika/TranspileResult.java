package com.saika;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of running the whole pipeline over one source file. The output is always present,
 * but it is only meaningful when {@link #hasErrors()} is false.
 */
public record TranspileResult(
    String fileName,
    String output,
    List<Diagnostic> lexicalWarnings,
    List<Diagnostic> syntaxErrors,
    List<Diagnostic> generationErrors
) {

    public TranspileResult {
        lexicalWarnings = List.copyOf(lexicalWarnings);
        syntaxErrors = List.copyOf(syntaxErrors);
        generationErrors = List.copyOf(generationErrors);
    }

    public boolean hasErrors() {
        return !syntaxErrors.isEmpty() || !generationErrors.isEmpty();
    }

    /** Every diagnostic in pipeline order: warnings, then syntax errors, then generation errors. */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>(lexicalWarnings);
        all.addAll(syntaxErrors);
        all.addAll(generationErrors);
        return all;
    }

    /**
     * Returns the generated Go source, or throws if any stage reported an error.
     * Lexical warnings alone do not fail the result.
     */
    public String requireSuccess() {
        if (hasErrors()) {
            List<Diagnostic> errors = new ArrayList<>(syntaxErrors);
            errors.addAll(generationErrors);
            throw new TranspileException(fileName, errors);
        }
        return output;
    }
}
