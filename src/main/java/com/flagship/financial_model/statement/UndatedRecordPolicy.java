package com.flagship.financial_model.statement;

/**
 * What the aggregator does with records that have no transaction date.
 */
public enum UndatedRecordPolicy {
    /**
     * Exclude them and keep going. The validator reports them separately.
     */
    DROP_UNDATED,
    /**
     * Refuse to aggregate.
     */
    REJECT_UNDATED
}
