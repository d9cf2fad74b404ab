package com.flagship.financial_model.classification;

import com.flagship.financial_model.ledger.LedgerRecord;
import lombok.Value;

import java.util.Objects;

/**
 * A ledger record together with the category it was assigned.
 * The category is fixed at construction and never reassigned.
 */
@Value
public class ClassifiedRecord {
    LedgerRecord record;
    FsliCategory category;

    private ClassifiedRecord(LedgerRecord record, FsliCategory category) {
        this.record = Objects.requireNonNull(record);
        this.category = Objects.requireNonNull(category);
    }

    public static ClassifiedRecord of(LedgerRecord record, FsliCategory category) {
        return new ClassifiedRecord(record, category);
    }
}
