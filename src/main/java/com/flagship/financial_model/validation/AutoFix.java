package com.flagship.financial_model.validation;

/**
 * Corrections a caller may opt into for issues the validator reports.
 */
public enum AutoFix {
    REMOVE_MISSING_DATES,
    MAP_UNCLASSIFIED,
    FIX_ACCOUNT_NUMBERS,
    REMOVE_DUPLICATES,
    REMOVE_FUTURE_DATES
}
