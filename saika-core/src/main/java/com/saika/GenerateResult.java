package com.saika;

import java.util.List;

public record GenerateResult(String output, List<Diagnostic> errors) {

    public GenerateResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
