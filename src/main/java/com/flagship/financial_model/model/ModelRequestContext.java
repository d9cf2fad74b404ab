package com.flagship.financial_model.model;

import com.flagship.financial_model.classification.AccountRange;
import com.flagship.financial_model.classification.FsliCategory;
import com.flagship.financial_model.ledger.LedgerRecord;
import com.flagship.financial_model.reconciliation.ReconciliationChecker;
import com.flagship.financial_model.statement.StatementMerger;
import com.flagship.financial_model.validation.AutoFix;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one model run needs. Each request builds its own context;
 * services keep no state between runs.
 */
@Value
@Builder
public class ModelRequestContext {

    @Builder.Default
    List<LedgerRecord> trialBalance = List.of();

    @Builder.Default
    List<LedgerRecord> glActivity = List.of();

    /**
     * Replaces the default range table when non-empty.
     */
    @Builder.Default
    Map<FsliCategory, AccountRange> customRanges = Map.of();

    @Builder.Default
    int statementYears = StatementMerger.DEFAULT_STATEMENT_YEAR_COUNT;

    /**
     * Critical validation issues abort the run when set.
     */
    boolean strict;

    /**
     * Applied to both datasets before validation.
     */
    @Builder.Default
    Set<AutoFix> autoFixes = Set.of();

    @Builder.Default
    BigDecimal reconciliationTolerance = ReconciliationChecker.DEFAULT_TOLERANCE;

    public boolean hasTrialBalance() {
        return trialBalance != null && !trialBalance.isEmpty();
    }

    public boolean hasGlActivity() {
        return glActivity != null && !glActivity.isEmpty();
    }
}
