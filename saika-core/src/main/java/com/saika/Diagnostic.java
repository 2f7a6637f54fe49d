package com.saika;

import com.saika.ast.Position;

/**
 * A position-tagged message produced by one of the pipeline stages.
 * Diagnostics are collected and returned alongside the result; they are never thrown.
 */
public record Diagnostic(Severity severity, String message, Position position) {

    public enum Severity {
        WARNING,
        ERROR
    }

    public static Diagnostic error(String message, Position position) {
        return new Diagnostic(Severity.ERROR, message, position);
    }

    public static Diagnostic warning(String message, Position position) {
        return new Diagnostic(Severity.WARNING, message, position);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats as {@code file:line:column: message}, or {@code line L, column C: message}
     * when the position carries no file name.
     */
    @Override
    public String toString() {
        return position + ": " + message;
    }
}
