package com.codelogickeep.agent.adapter.model;

import java.util.List;

/**
 * Result of validating candidate test source without executing it.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult ok(List<String> warnings) {
        return new ValidationResult(true, List.of(), warnings);
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, errors, List.of());
    }
}
