package com.flagship.financial_model.model;

import com.flagship.financial_model.classification.AccountClassifier;
import com.flagship.financial_model.classification.AccountRangeTable;
import com.flagship.financial_model.classification.ClassifiedRecord;
import com.flagship.financial_model.classification.MappingStats;
import com.flagship.financial_model.ledger.LedgerRecord;
import com.flagship.financial_model.observability.CorrelationContext;
import com.flagship.financial_model.observability.ModelMetrics;
import com.flagship.financial_model.reconciliation.ReconciliationChecker;
import com.flagship.financial_model.reconciliation.ReconciliationResult;
import com.flagship.financial_model.report.RatioCalculator;
import com.flagship.financial_model.report.StatementReportBuilder;
import com.flagship.financial_model.statement.AggregationMode;
import com.flagship.financial_model.statement.MissingOpeningSnapshotException;
import com.flagship.financial_model.statement.StatementAggregator;
import com.flagship.financial_model.statement.StatementMerger;
import com.flagship.financial_model.statement.StatementSeries;
import com.flagship.financial_model.statement.YearStatement;
import com.flagship.financial_model.validation.AutoFixResult;
import com.flagship.financial_model.validation.InputValidationException;
import com.flagship.financial_model.validation.InputValidator;
import com.flagship.financial_model.validation.ValidationIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

/**
 * Runs the full pipeline for one request: auto-fix, validate, classify,
 * aggregate, merge, reconcile and lay out the statements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FinancialModelService {

    private final InputValidator validator;
    private final AccountClassifier classifier;
    private final StatementAggregator aggregator;
    private final StatementMerger merger;
    private final ReconciliationChecker reconciliationChecker;
    private final StatementReportBuilder reportBuilder;
    private final RatioCalculator ratioCalculator;
    private final ModelMetrics metrics;

    /**
     * Generates the three-statement model.
     *
     * @throws MissingDatasetException when neither dataset has records
     * @throws InputValidationException in strict mode when any critical issue is found
     * @throws MissingOpeningSnapshotException when both datasets are present
     *         but the trial balance lacks the opening year
     */
    public FinancialModelResult generate(ModelRequestContext context) {
        long startTime = System.nanoTime();
        ModelSource source = sourceOf(context);
        MDC.put(CorrelationContext.DATASETS_MDC_KEY, source.key());

        try {
            List<String> changes = new ArrayList<>();
            List<LedgerRecord> trialBalance = autoFix(context.getTrialBalance(), context, changes);
            List<LedgerRecord> glActivity = autoFix(context.getGlActivity(), context, changes);

            List<ValidationIssue> issues = validate(trialBalance, glActivity, context);

            AccountRangeTable ranges = AccountRangeTable.of(context.getCustomRanges());
            List<ClassifiedRecord> tbClassified = classifier.classifyAll(trialBalance, ranges);
            List<ClassifiedRecord> glClassified = classifier.classifyAll(glActivity, ranges);

            List<ClassifiedRecord> allClassified = new ArrayList<>(tbClassified);
            allClassified.addAll(glClassified);
            MappingStats stats = classifier.mappingStats(allClassified);
            metrics.recordRecordsClassified(stats.getMappedAccounts(), stats.getUnclassifiedAccounts());

            StatementSeries series = buildSeries(source, tbClassified, glClassified, context.getStatementYears());

            SortedMap<Integer, ReconciliationResult> reconciliation =
                reconciliationChecker.reconcile(series.getStatements());
            boolean reconciled = checkTolerance(reconciliation, context.getReconciliationTolerance());

            SortedMap<Integer, YearStatement> visible = series.visibleStatements();
            FinancialModelResult result = FinancialModelResult.builder()
                .source(source)
                .openingYear(series.getOpeningYear())
                .statementYears(series.statementYears())
                .statements(visible)
                .reconciliation(reconciliation)
                .reconciled(reconciled)
                .mappingStats(stats)
                .issues(List.copyOf(issues))
                .autoFixChanges(List.copyOf(changes))
                .reports(reportBuilder.buildAll(visible))
                .keyRatios(ratioCalculator.calculate(visible))
                .build();

            metrics.recordModelGenerated("success", source.key());
            log.info("Model generated: source={}, years={}, reconciled={}, issues={}",
                source.key(), result.getStatementYears(), reconciled, issues.size());
            return result;

        } catch (InputValidationException e) {
            metrics.recordModelGenerated("validation_error", source.key());
            throw e;
        } catch (MissingOpeningSnapshotException e) {
            metrics.recordModelGenerated("missing_opening_snapshot", source.key());
            throw e;
        } finally {
            metrics.recordGenerationDuration(Duration.ofNanos(System.nanoTime() - startTime));
            MDC.remove(CorrelationContext.DATASETS_MDC_KEY);
        }
    }

    /**
     * Runs validation only, after any requested auto-fixes.
     */
    public List<ValidationIssue> validate(ModelRequestContext context) {
        List<String> changes = new ArrayList<>();
        List<LedgerRecord> trialBalance = autoFix(context.getTrialBalance(), context, changes);
        List<LedgerRecord> glActivity = autoFix(context.getGlActivity(), context, changes);
        List<ValidationIssue> issues = validator.validateDatasets(
            trialBalance, glActivity, context.getStatementYears(), context.isStrict());
        issues.forEach(issue -> metrics.recordValidationIssue(issue.getSeverity().name()));
        return issues;
    }

    private ModelSource sourceOf(ModelRequestContext context) {
        if (context.hasTrialBalance() && context.hasGlActivity()) {
            return ModelSource.MERGED;
        }
        if (context.hasTrialBalance()) {
            return ModelSource.TRIAL_BALANCE_ONLY;
        }
        if (context.hasGlActivity()) {
            return ModelSource.GL_ACTIVITY_ONLY;
        }
        metrics.recordModelGenerated("missing_dataset", "none");
        throw new MissingDatasetException();
    }

    private List<LedgerRecord> autoFix(List<LedgerRecord> records, ModelRequestContext context, List<String> changes) {
        if (records == null || records.isEmpty() || context.getAutoFixes().isEmpty()) {
            return records == null ? List.of() : records;
        }
        AutoFixResult fixed = validator.applyAutoFixes(records, context.getAutoFixes());
        changes.addAll(fixed.getChanges());
        return fixed.getRecords();
    }

    private List<ValidationIssue> validate(List<LedgerRecord> trialBalance,
                                           List<LedgerRecord> glActivity,
                                           ModelRequestContext context) {
        List<ValidationIssue> issues = validator.validateDatasets(
            trialBalance, glActivity, context.getStatementYears(), context.isStrict());
        issues.forEach(issue -> metrics.recordValidationIssue(issue.getSeverity().name()));

        if (context.isStrict() && issues.stream().anyMatch(ValidationIssue::isCritical)) {
            throw new InputValidationException(issues);
        }
        return issues;
    }

    private StatementSeries buildSeries(ModelSource source,
                                        List<ClassifiedRecord> tbClassified,
                                        List<ClassifiedRecord> glClassified,
                                        int statementYears) {
        return switch (source) {
            case MERGED -> merger.merge(
                aggregator.aggregate(tbClassified, AggregationMode.SNAPSHOT),
                aggregator.aggregate(glClassified, AggregationMode.ACTIVITY),
                statementYears).freeze();
            case TRIAL_BALANCE_ONLY -> StatementSeries.withoutOpeningYear(
                aggregator.aggregate(tbClassified, AggregationMode.SNAPSHOT)).freeze();
            case GL_ACTIVITY_ONLY -> StatementSeries.withoutOpeningYear(
                aggregator.aggregate(glClassified, AggregationMode.ACTIVITY)).freeze();
        };
    }

    private boolean checkTolerance(SortedMap<Integer, ReconciliationResult> reconciliation, BigDecimal tolerance) {
        boolean reconciled = true;
        for (ReconciliationResult result : reconciliation.values()) {
            if (!result.isBalanceSheetReconciled(tolerance)) {
                metrics.recordReconciliationBreach("balance_sheet");
                log.warn("Balance sheet does not balance for {}: difference={}",
                    result.getYear(), result.getBalanceSheetCheck());
                reconciled = false;
            }
            if (!result.isCashFlowReconciled(tolerance)) {
                metrics.recordReconciliationBreach("cash_flow");
                log.warn("Cash roll-forward does not tie for {}: difference={}",
                    result.getYear(), result.getCashflowCheck());
                reconciled = false;
            }
        }
        return reconciled;
    }
}
