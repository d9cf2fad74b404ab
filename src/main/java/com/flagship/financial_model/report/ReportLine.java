package com.flagship.financial_model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A rendered report row: its label and one value per statement year.
 * Headers and blank rows carry no values.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ReportLine {

    @JsonProperty("label")
    String label;

    @JsonProperty("kind")
    ReportRow.Kind kind;

    @JsonProperty("total")
    boolean total;

    @JsonProperty("values")
    Map<Integer, BigDecimal> values;
}
