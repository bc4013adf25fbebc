package com.apitool.model.execution;

import java.util.List;
import java.util.Map;

/**
 * Result of validating caller parameters against a {@link DerivedInputSchema}.
 *
 * @param validatedParams The accepted parameters; {@code null} unless valid.
 * @param issues          One entry per violated constraint.
 * @param processFailure  Set when the validator itself could not run.
 */
public record ValidationResult(Map<String, Object> validatedParams, List<ValidationIssue> issues, String processFailure) {

    public static ValidationResult valid(Map<String, Object> params) {
        return new ValidationResult(params, List.of(), null);
    }

    public static ValidationResult invalid(List<ValidationIssue> issues) {
        return new ValidationResult(null, List.copyOf(issues), null);
    }

    public static ValidationResult processFailed(String message) {
        return new ValidationResult(null, List.of(), message);
    }

    public boolean isValid() {
        return validatedParams != null;
    }
}
