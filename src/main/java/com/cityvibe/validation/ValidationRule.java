package com.cityvibe.validation;

import com.cityvibe.domain.EventDraft;

import java.util.Optional;

/**
 * A single, independently evaluable validation rule.
 */
public interface ValidationRule {

    /**
     * Stable rule name, used as the prefix of every reason this rule reports
     */
    String getName();

    /**
     * Evaluate the rule against a draft
     *
     * @param draft the draft to check
     * @return a human-readable failure detail, or empty if the draft passes
     */
    Optional<String> check(EventDraft draft);
}
