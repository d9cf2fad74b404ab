package com.flagship.financial_model.ledger;

/**
 * Semantics of an input dataset.
 *
 * A trial balance is a point-in-time snapshot of ending balances.
 * GL activity is transaction postings summed over a period.
 */
public enum DatasetType {
    TRIAL_BALANCE,
    GL_ACTIVITY
}
