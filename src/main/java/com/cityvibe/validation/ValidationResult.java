package com.cityvibe.validation;

import java.util.Collections;
import java.util.List;

/**
 * Result of validating one draft: either ok or rejected with one or more reasons.
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(Collections.emptyList());

    private final List<String> reasons;

    private ValidationResult(List<String> reasons) {
        this.reasons = reasons;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one reason");
        }
        return new ValidationResult(List.copyOf(reasons));
    }

    public boolean isValid() {
        return reasons.isEmpty();
    }

    public List<String> getReasons() {
        return reasons;
    }

    @Override
    public String toString() {
        return isValid() ? "Ok" : "Rejected" + reasons;
    }
}
