package com.flagship.financial_model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Value
@Builder
public class ReportTable {

    @JsonProperty("title")
    String title;

    @JsonProperty("years")
    List<Integer> years;

    @JsonProperty("lines")
    List<ReportLine> lines;

    /**
     * Value of the first line with the given label for a year.
     */
    public Optional<BigDecimal> valueOf(String label, int year) {
        return lines.stream()
            .filter(line -> line.getLabel().equals(label) && line.getValues() != null)
            .findFirst()
            .map(line -> line.getValues().get(year));
    }
}
