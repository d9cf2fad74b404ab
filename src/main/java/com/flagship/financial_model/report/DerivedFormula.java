package com.flagship.financial_model.report;

import com.flagship.financial_model.reconciliation.ReconciliationChecker;
import com.flagship.financial_model.statement.LineItem;
import com.flagship.financial_model.statement.YearStatement;

import java.math.BigDecimal;

/**
 * Report values computed from other line items rather than read directly.
 *
 * Each formula recomputes from the underlying items so the report stays
 * correct for statements whose subtotals were never stored.
 */
public enum DerivedFormula {
    GROSS_PROFIT,
    TOTAL_OPEX,
    EBIT,
    EBT,
    NET_INCOME,
    TOTAL_CURRENT_ASSETS,
    ACCUMULATED_DEPRECIATION_CONTRA,
    NET_PPE,
    TOTAL_ASSETS,
    TOTAL_CURRENT_LIABILITIES,
    TOTAL_LIABILITIES,
    TOTAL_EQUITY,
    TOTAL_LIABILITIES_AND_EQUITY,
    OPERATING_CASH_FLOW,
    INVESTING_CASH_FLOW,
    DIVIDENDS_PAID,
    FINANCING_CASH_FLOW,
    NET_CHANGE_IN_CASH;

    public BigDecimal evaluate(YearStatement s) {
        return switch (this) {
            case GROSS_PROFIT -> s.get(LineItem.REVENUE).subtract(s.get(LineItem.COGS));
            case TOTAL_OPEX -> s.get(LineItem.DISTRIBUTION_EXPENSES)
                .add(s.get(LineItem.MARKETING_ADMIN))
                .add(s.get(LineItem.RESEARCH_DEV))
                .add(s.get(LineItem.DEPRECIATION_EXPENSE));
            case EBIT -> GROSS_PROFIT.evaluate(s).subtract(TOTAL_OPEX.evaluate(s));
            case EBT -> EBIT.evaluate(s).subtract(s.get(LineItem.INTEREST_EXPENSE));
            case NET_INCOME -> EBT.evaluate(s).subtract(s.get(LineItem.TAX_EXPENSE));
            case TOTAL_CURRENT_ASSETS -> s.get(LineItem.CASH)
                .add(s.get(LineItem.ACCOUNTS_RECEIVABLE))
                .add(s.get(LineItem.INVENTORY))
                .add(s.get(LineItem.PREPAID_EXPENSES))
                .add(s.get(LineItem.OTHER_CURRENT_ASSETS));
            case ACCUMULATED_DEPRECIATION_CONTRA -> s.get(LineItem.ACCUMULATED_DEPRECIATION).negate();
            case NET_PPE -> s.get(LineItem.PPE_GROSS).subtract(s.get(LineItem.ACCUMULATED_DEPRECIATION));
            case TOTAL_ASSETS -> ReconciliationChecker.totalAssets(s);
            case TOTAL_CURRENT_LIABILITIES -> TOTAL_LIABILITIES.evaluate(s).subtract(s.get(LineItem.LONG_TERM_DEBT));
            case TOTAL_LIABILITIES -> ReconciliationChecker.totalLiabilities(s);
            case TOTAL_EQUITY -> s.get(LineItem.COMMON_STOCK).add(s.get(LineItem.RETAINED_EARNINGS));
            case TOTAL_LIABILITIES_AND_EQUITY -> TOTAL_LIABILITIES.evaluate(s).add(TOTAL_EQUITY.evaluate(s));
            case OPERATING_CASH_FLOW -> NET_INCOME.evaluate(s)
                .add(s.get(LineItem.DEPRECIATION_EXPENSE))
                .add(ReconciliationChecker.workingCapitalChange(s));
            case INVESTING_CASH_FLOW -> s.get(LineItem.CAPEX);
            case DIVIDENDS_PAID -> s.get(LineItem.DIVIDENDS).negate();
            case FINANCING_CASH_FLOW -> ReconciliationChecker.financingCashFlow(s);
            case NET_CHANGE_IN_CASH -> OPERATING_CASH_FLOW.evaluate(s)
                .add(INVESTING_CASH_FLOW.evaluate(s))
                .add(FINANCING_CASH_FLOW.evaluate(s));
        };
    }
}
