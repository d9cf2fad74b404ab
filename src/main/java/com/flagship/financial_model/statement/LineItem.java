package com.flagship.financial_model.statement;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.financial_model.classification.FsliCategory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Keys of a {@link YearStatement}.
 *
 * Balance-sheet and income-statement items are aggregated straight from a
 * classified category; subtotals and cash-flow items are derived.
 */
public enum LineItem {

    // Balance sheet
    CASH(Section.BALANCE_SHEET, FsliCategory.CASH),
    ACCOUNTS_RECEIVABLE(Section.BALANCE_SHEET, FsliCategory.ACCOUNTS_RECEIVABLE),
    INVENTORY(Section.BALANCE_SHEET, FsliCategory.INVENTORY),
    PREPAID_EXPENSES(Section.BALANCE_SHEET, FsliCategory.PREPAID_EXPENSES),
    OTHER_CURRENT_ASSETS(Section.BALANCE_SHEET, FsliCategory.OTHER_CURRENT_ASSETS),
    PPE_GROSS(Section.BALANCE_SHEET, FsliCategory.PPE_GROSS),
    ACCUMULATED_DEPRECIATION(Section.BALANCE_SHEET, FsliCategory.ACCUMULATED_DEPRECIATION),
    ACCOUNTS_PAYABLE(Section.BALANCE_SHEET, FsliCategory.ACCOUNTS_PAYABLE),
    ACCRUED_PAYROLL(Section.BALANCE_SHEET, FsliCategory.ACCRUED_PAYROLL),
    DEFERRED_REVENUE(Section.BALANCE_SHEET, FsliCategory.DEFERRED_REVENUE),
    INTEREST_PAYABLE(Section.BALANCE_SHEET, FsliCategory.INTEREST_PAYABLE),
    OTHER_CURRENT_LIABILITIES(Section.BALANCE_SHEET, FsliCategory.OTHER_CURRENT_LIABILITIES),
    INCOME_TAXES_PAYABLE(Section.BALANCE_SHEET, FsliCategory.INCOME_TAXES_PAYABLE),
    LONG_TERM_DEBT(Section.BALANCE_SHEET, FsliCategory.LONG_TERM_DEBT),
    COMMON_STOCK(Section.BALANCE_SHEET, FsliCategory.COMMON_STOCK),
    RETAINED_EARNINGS(Section.BALANCE_SHEET, FsliCategory.RETAINED_EARNINGS),

    // Income statement
    REVENUE(Section.INCOME_STATEMENT, FsliCategory.REVENUE),
    COGS(Section.INCOME_STATEMENT, FsliCategory.COGS),
    DISTRIBUTION_EXPENSES(Section.INCOME_STATEMENT, FsliCategory.DISTRIBUTION_EXPENSES),
    MARKETING_ADMIN(Section.INCOME_STATEMENT, FsliCategory.MARKETING_ADMIN),
    RESEARCH_DEV(Section.INCOME_STATEMENT, FsliCategory.RESEARCH_DEV),
    DEPRECIATION_EXPENSE(Section.INCOME_STATEMENT, FsliCategory.DEPRECIATION_EXPENSE),
    INTEREST_EXPENSE(Section.INCOME_STATEMENT, FsliCategory.INTEREST_EXPENSE),
    TAX_EXPENSE(Section.INCOME_STATEMENT, FsliCategory.TAX_EXPENSE),
    NET_INCOME(Section.INCOME_STATEMENT, null),

    // Income statement subtotals
    GROSS_PROFIT(Section.SUBTOTAL, null),
    TOTAL_OPEX(Section.SUBTOTAL, null),
    EBIT(Section.SUBTOTAL, null),
    EBT(Section.SUBTOTAL, null),

    // Cash-flow drivers
    DELTA_AR(Section.CASH_FLOW, null),
    DELTA_INVENTORY(Section.CASH_FLOW, null),
    DELTA_PREPAID(Section.CASH_FLOW, null),
    DELTA_OTHER_CURRENT_ASSETS(Section.CASH_FLOW, null),
    DELTA_AP(Section.CASH_FLOW, null),
    DELTA_ACCRUED_PAYROLL(Section.CASH_FLOW, null),
    DELTA_DEFERRED_REVENUE(Section.CASH_FLOW, null),
    DELTA_INTEREST_PAYABLE(Section.CASH_FLOW, null),
    DELTA_OTHER_CURRENT_LIABILITIES(Section.CASH_FLOW, null),
    DELTA_INCOME_TAXES_PAYABLE(Section.CASH_FLOW, null),
    DELTA_DEBT(Section.CASH_FLOW, null),
    CAPEX(Section.CASH_FLOW, null),
    STOCK_ISSUANCE(Section.CASH_FLOW, null),
    DIVIDENDS(Section.CASH_FLOW, null);

    public enum Section {
        BALANCE_SHEET,
        INCOME_STATEMENT,
        SUBTOTAL,
        CASH_FLOW
    }

    private final Section section;
    private final FsliCategory category;

    LineItem(Section section, FsliCategory category) {
        this.section = section;
        this.category = category;
    }

    public Section getSection() {
        return section;
    }

    /**
     * Category this item is aggregated from, or null for derived items.
     */
    public FsliCategory getCategory() {
        return category;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<LineItem> inSection(Section section) {
        return Arrays.stream(values())
            .filter(item -> item.section == section)
            .toList();
    }
}
