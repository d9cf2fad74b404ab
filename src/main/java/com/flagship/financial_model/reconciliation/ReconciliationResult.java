package com.flagship.financial_model.reconciliation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Reconciliation residuals for one statement year.
 *
 * Both checks should be close to zero for a self-consistent model. The
 * retained-earnings figures are diagnostics only.
 */
@Value
@Builder
public class ReconciliationResult {

    @JsonProperty("year")
    int year;

    /**
     * Assets minus (liabilities + equity as booked).
     */
    @JsonProperty("balance_sheet_check")
    BigDecimal balanceSheetCheck;

    /**
     * Reported ending cash minus roll-forward ending cash.
     */
    @JsonProperty("cashflow_check")
    BigDecimal cashflowCheck;

    @JsonProperty("retained_earnings_calc")
    BigDecimal retainedEarningsCalc;

    @JsonProperty("retained_earnings_tb")
    BigDecimal retainedEarningsTb;

    @JsonProperty("retained_earnings_diff")
    BigDecimal retainedEarningsDiff;

    @JsonIgnore
    public boolean isBalanceSheetReconciled(BigDecimal tolerance) {
        return balanceSheetCheck.abs().compareTo(tolerance) <= 0;
    }

    @JsonIgnore
    public boolean isCashFlowReconciled(BigDecimal tolerance) {
        return cashflowCheck.abs().compareTo(tolerance) <= 0;
    }

    /**
     * True when both checks are within the tolerance. The retained-earnings
     * difference does not count.
     */
    public boolean isReconciled(BigDecimal tolerance) {
        return isBalanceSheetReconciled(tolerance) && isCashFlowReconciled(tolerance);
    }
}
