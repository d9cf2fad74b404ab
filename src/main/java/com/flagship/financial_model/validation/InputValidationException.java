package com.flagship.financial_model.validation;

import java.util.List;

/**
 * Input failed validation with at least one critical issue.
 */
public class InputValidationException extends RuntimeException {

    private final List<ValidationIssue> issues;

    public InputValidationException(List<ValidationIssue> issues) {
        super(buildMessage(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String buildMessage(List<ValidationIssue> issues) {
        long critical = issues.stream().filter(ValidationIssue::isCritical).count();
        String first = issues.stream()
            .filter(ValidationIssue::isCritical)
            .map(ValidationIssue::getIssue)
            .findFirst()
            .orElse("no critical issues");
        return String.format("Input validation failed with %d critical issue(s): %s", critical, first);
    }
}
