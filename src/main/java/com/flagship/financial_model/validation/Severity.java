package com.flagship.financial_model.validation;

/**
 * How serious a validation issue is. In strict mode any CRITICAL issue
 * stops model generation.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
