package com.flagship.financial_model.statement;

import com.flagship.financial_model.ledger.DatasetType;

/**
 * How records within a calendar year are combined.
 */
public enum AggregationMode {
    /**
     * Point-in-time balances: only records on the latest date of each year count.
     */
    SNAPSHOT,
    /**
     * Period activity: every record of the year is summed.
     */
    ACTIVITY;

    public static AggregationMode forDataset(DatasetType type) {
        return type == DatasetType.TRIAL_BALANCE ? SNAPSHOT : ACTIVITY;
    }
}
