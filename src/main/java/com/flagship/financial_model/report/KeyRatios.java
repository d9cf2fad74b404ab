package com.flagship.financial_model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Headline ratios for one statement year. Margins and growth are
 * percentages; debt to equity is a multiple.
 */
@Value
@Builder
public class KeyRatios {

    @JsonProperty("year")
    int year;

    @JsonProperty("gross_margin_pct")
    BigDecimal grossMarginPct;

    @JsonProperty("ebit_margin_pct")
    BigDecimal ebitMarginPct;

    @JsonProperty("net_margin_pct")
    BigDecimal netMarginPct;

    /**
     * Versus the previous statement year; zero for the first.
     */
    @JsonProperty("revenue_growth_pct")
    BigDecimal revenueGrowthPct;

    @JsonProperty("debt_to_equity")
    BigDecimal debtToEquity;
}
