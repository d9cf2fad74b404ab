package com.flagship.financial_model.report;

import com.flagship.financial_model.statement.LineItem;

import java.util.List;

import static com.flagship.financial_model.report.ReportRow.blank;
import static com.flagship.financial_model.report.ReportRow.derived;
import static com.flagship.financial_model.report.ReportRow.direct;
import static com.flagship.financial_model.report.ReportRow.header;
import static com.flagship.financial_model.report.ReportRow.total;

/**
 * Standard presentation of the three statements.
 */
public enum StatementLayout {

    INCOME_STATEMENT("Income Statement", List.of(
        direct("Revenues", LineItem.REVENUE),
        direct("Cost of Goods Sold", LineItem.COGS),
        derived("Gross Profit", DerivedFormula.GROSS_PROFIT),
        blank(),
        header("Operating Expenses:"),
        direct("Distribution Expenses", LineItem.DISTRIBUTION_EXPENSES),
        direct("Marketing and Administration", LineItem.MARKETING_ADMIN),
        direct("Research and Development", LineItem.RESEARCH_DEV),
        direct("Depreciation", LineItem.DEPRECIATION_EXPENSE),
        derived("Total Operating Expenses", DerivedFormula.TOTAL_OPEX),
        blank(),
        derived("EBIT (Operating Profit)", DerivedFormula.EBIT),
        direct("Interest Expense", LineItem.INTEREST_EXPENSE),
        derived("Income Before Taxes", DerivedFormula.EBT),
        direct("Income Tax Expense", LineItem.TAX_EXPENSE),
        total("Net Income", DerivedFormula.NET_INCOME)
    )),

    BALANCE_SHEET("Balance Sheet", List.of(
        header("ASSETS"),
        header("Current Assets:"),
        direct("Cash", LineItem.CASH),
        direct("Accounts Receivable", LineItem.ACCOUNTS_RECEIVABLE),
        direct("Inventory", LineItem.INVENTORY),
        direct("Prepaid Expenses", LineItem.PREPAID_EXPENSES),
        direct("Other Current Assets", LineItem.OTHER_CURRENT_ASSETS),
        derived("Total Current Assets", DerivedFormula.TOTAL_CURRENT_ASSETS),
        blank(),
        header("Non-Current Assets:"),
        direct("Property, Plant & Equipment - Gross", LineItem.PPE_GROSS),
        derived("Less: Accumulated Depreciation", DerivedFormula.ACCUMULATED_DEPRECIATION_CONTRA),
        derived("Property, Plant & Equipment - Net", DerivedFormula.NET_PPE),
        total("TOTAL ASSETS", DerivedFormula.TOTAL_ASSETS),
        blank(),
        header("LIABILITIES AND EQUITY"),
        header("Current Liabilities:"),
        direct("Accounts Payable", LineItem.ACCOUNTS_PAYABLE),
        direct("Accrued Payroll", LineItem.ACCRUED_PAYROLL),
        direct("Deferred Revenue", LineItem.DEFERRED_REVENUE),
        direct("Interest Payable", LineItem.INTEREST_PAYABLE),
        direct("Other Current Liabilities", LineItem.OTHER_CURRENT_LIABILITIES),
        direct("Income Taxes Payable", LineItem.INCOME_TAXES_PAYABLE),
        derived("Total Current Liabilities", DerivedFormula.TOTAL_CURRENT_LIABILITIES),
        blank(),
        header("Non-Current Liabilities:"),
        direct("Long-Term Debt", LineItem.LONG_TERM_DEBT),
        derived("Total Liabilities", DerivedFormula.TOTAL_LIABILITIES),
        blank(),
        header("Shareholders' Equity:"),
        direct("Common Stock and APIC", LineItem.COMMON_STOCK),
        direct("Retained Earnings", LineItem.RETAINED_EARNINGS),
        derived("Total Shareholders' Equity", DerivedFormula.TOTAL_EQUITY),
        blank(),
        total("TOTAL LIABILITIES AND EQUITY", DerivedFormula.TOTAL_LIABILITIES_AND_EQUITY)
    )),

    CASH_FLOW("Cash Flow Statement", List.of(
        header("Operating Activities:"),
        derived("Net Income", DerivedFormula.NET_INCOME),
        direct("Depreciation", LineItem.DEPRECIATION_EXPENSE),
        direct("Change in Accounts Receivable", LineItem.DELTA_AR),
        direct("Change in Inventory", LineItem.DELTA_INVENTORY),
        direct("Change in Prepaid Expenses", LineItem.DELTA_PREPAID),
        direct("Change in Other Current Assets", LineItem.DELTA_OTHER_CURRENT_ASSETS),
        direct("Change in Accounts Payable", LineItem.DELTA_AP),
        direct("Change in Accrued Payroll", LineItem.DELTA_ACCRUED_PAYROLL),
        direct("Change in Deferred Revenue", LineItem.DELTA_DEFERRED_REVENUE),
        direct("Change in Interest Payable", LineItem.DELTA_INTEREST_PAYABLE),
        direct("Change in Other Current Liabilities", LineItem.DELTA_OTHER_CURRENT_LIABILITIES),
        direct("Change in Income Taxes Payable", LineItem.DELTA_INCOME_TAXES_PAYABLE),
        derived("Cash from Operating Activities", DerivedFormula.OPERATING_CASH_FLOW),
        blank(),
        header("Investing Activities:"),
        direct("Acquisitions of PP&E", LineItem.CAPEX),
        derived("Cash from Investing Activities", DerivedFormula.INVESTING_CASH_FLOW),
        blank(),
        header("Financing Activities:"),
        direct("Issuance of Common Stock", LineItem.STOCK_ISSUANCE),
        derived("Dividends", DerivedFormula.DIVIDENDS_PAID),
        direct("Change in Long-Term Debt", LineItem.DELTA_DEBT),
        derived("Cash from Financing Activities", DerivedFormula.FINANCING_CASH_FLOW),
        blank(),
        total("Net Change in Cash", DerivedFormula.NET_CHANGE_IN_CASH)
    ));

    private final String title;
    private final List<ReportRow> rows;

    StatementLayout(String title, List<ReportRow> rows) {
        this.title = title;
        this.rows = rows;
    }

    public String getTitle() {
        return title;
    }

    public List<ReportRow> getRows() {
        return rows;
    }
}
