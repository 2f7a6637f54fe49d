package com.saika;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link TranspileResult#requireSuccess()} when a source file produced errors.
 * The message lists every error, one per line.
 */
public class TranspileException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public TranspileException(String fileName, List<Diagnostic> diagnostics) {
        super(buildMessage(fileName, diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(String fileName, List<Diagnostic> diagnostics) {
        String name = fileName == null || fileName.isEmpty() ? "<input>" : fileName;
        return diagnostics.stream()
            .map(Diagnostic::toString)
            .collect(Collectors.joining("\n", "failed to transpile " + name + ":\n", ""));
    }
}
