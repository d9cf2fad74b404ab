package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class ClassifyRequest {

    @Valid
    @NotEmpty(message = "At least one record is required")
    @JsonProperty("records")
    List<LedgerRecordRequest> records;

    @JsonProperty("custom_ranges")
    Map<String, List<Integer>> customRanges;
}
