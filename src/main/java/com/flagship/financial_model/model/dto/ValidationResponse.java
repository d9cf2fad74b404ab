package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.validation.Severity;
import com.flagship.financial_model.validation.ValidationIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ValidationResponse {

    /**
     * True when no critical issue was found.
     */
    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("critical_count")
    long criticalCount;

    @JsonProperty("warning_count")
    long warningCount;

    @JsonProperty("info_count")
    long infoCount;

    @JsonProperty("issues")
    List<ValidationIssue> issues;

    public static ValidationResponse from(List<ValidationIssue> issues) {
        long critical = count(issues, Severity.CRITICAL);
        return ValidationResponse.builder()
            .valid(critical == 0)
            .criticalCount(critical)
            .warningCount(count(issues, Severity.WARNING))
            .infoCount(count(issues, Severity.INFO))
            .issues(issues)
            .build();
    }

    private static long count(List<ValidationIssue> issues, Severity severity) {
        return issues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }
}
