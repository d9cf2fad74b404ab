package com.flagship.financial_model.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.ledger.DatasetType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A problem found in the input data.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {

    static final int MAX_AFFECTED_ROWS = 100;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("category")
    String category;

    @JsonProperty("dataset")
    DatasetType dataset;

    @JsonProperty("issue")
    String issue;

    @JsonProperty("impact")
    String impact;

    @JsonProperty("suggestion")
    String suggestion;

    @JsonProperty("auto_fix")
    AutoFix autoFix;

    /**
     * Zero-based indexes of affected input rows, at most 100.
     */
    @JsonProperty("affected_rows")
    List<Integer> affectedRows;

    @JsonProperty("total_affected")
    int totalAffected;

    @JsonProperty("detail")
    String detail;

    @JsonIgnore
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
