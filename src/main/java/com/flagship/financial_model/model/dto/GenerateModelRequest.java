package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.classification.AccountRange;
import com.flagship.financial_model.classification.FsliCategory;
import com.flagship.financial_model.validation.AutoFix;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request body for model generation and validation.
 */
@Value
@Builder
@Jacksonized
public class GenerateModelRequest {

    @Valid
    @JsonProperty("trial_balance")
    List<LedgerRecordRequest> trialBalance;

    @Valid
    @JsonProperty("gl_activity")
    List<LedgerRecordRequest> glActivity;

    /**
     * Category key to [start, end]; replaces the default range table.
     */
    @JsonProperty("custom_ranges")
    Map<String, @Size(min = 2, max = 2, message = "Range must be [start, end]") List<Integer>> customRanges;

    @Min(value = 1, message = "statement_years must be at least 1")
    @Max(value = 50, message = "statement_years must be at most 50")
    @JsonProperty("statement_years")
    Integer statementYears;

    @JsonProperty("strict")
    Boolean strict;

    @JsonProperty("auto_fixes")
    Set<AutoFix> autoFixes;

    /**
     * @throws IllegalArgumentException for an unknown category or an inverted range
     */
    public Map<FsliCategory, AccountRange> toRangeMap() {
        Map<FsliCategory, AccountRange> ranges = new LinkedHashMap<>();
        if (customRanges == null) {
            return ranges;
        }
        customRanges.forEach((key, bounds) -> {
            if (bounds == null || bounds.size() != 2 || bounds.get(0) == null || bounds.get(1) == null) {
                throw new IllegalArgumentException("Range for " + key + " must be [start, end]");
            }
            ranges.put(FsliCategory.fromKey(key), AccountRange.of(bounds.get(0), bounds.get(1)));
        });
        return ranges;
    }
}
