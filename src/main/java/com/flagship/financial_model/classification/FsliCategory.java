package com.flagship.financial_model.classification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Canonical financial statement line item (FSLI) categories.
 * A ledger account maps to exactly one of these, or to UNCLASSIFIED.
 */
public enum FsliCategory {
    // Assets
    CASH,
    ACCOUNTS_RECEIVABLE,
    INVENTORY,
    PREPAID_EXPENSES,
    OTHER_CURRENT_ASSETS,
    PPE_GROSS,
    ACCUMULATED_DEPRECIATION,
    OTHER_FIXED_ASSETS,

    // Liabilities
    ACCOUNTS_PAYABLE,
    ACCRUED_PAYROLL,
    DEFERRED_REVENUE,
    INTEREST_PAYABLE,
    OTHER_CURRENT_LIABILITIES,
    INCOME_TAXES_PAYABLE,
    LONG_TERM_DEBT,

    // Equity
    COMMON_STOCK,
    RETAINED_EARNINGS,
    DIVIDENDS,

    // Income statement
    REVENUE,
    COGS,
    DISTRIBUTION_EXPENSES,
    MARKETING_ADMIN,
    RESEARCH_DEV,
    DEPRECIATION_EXPENSE,
    OTHER_OPEX,
    INTEREST_EXPENSE,
    TAX_EXPENSE,

    UNCLASSIFIED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FsliCategory fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("FSLI category key is required");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(category -> category.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown FSLI category: " + key));
    }

    public boolean isClassified() {
        return this != UNCLASSIFIED;
    }
}
