package com.flagship.financial_model.validation;

import com.flagship.financial_model.ledger.LedgerRecord;
import lombok.Value;

import java.util.List;

/**
 * Records after auto-fixes, with one change-log line per fix that changed something.
 */
@Value
public class AutoFixResult {
    List<LedgerRecord> records;
    List<String> changes;
}
