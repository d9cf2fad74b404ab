package com.flagship.financial_model.validation;

import com.flagship.financial_model.ledger.DatasetType;
import com.flagship.financial_model.ledger.LedgerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Checks ledger input before the model is built.
 *
 * Trial balances must balance per snapshot date and overall. GL activity
 * must balance per transaction when transaction ids are available, and
 * overall otherwise. Common data-quality checks apply to both.
 *
 * The validator only reports; {@link #applyAutoFixes} applies the fixes a
 * caller selects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InputValidator {

    static final int UNCLASSIFIED_ACCOUNT_NUMBER = 9999;
    private static final int MAX_ACCOUNT_NUMBER = 99999;
    private static final double MIN_TRANSACTION_ID_COVERAGE = 0.5;

    private final ValidationTolerance tolerance;
    private final Clock clock;

    /**
     * Runs every check that applies to the supplied datasets.
     *
     * @param trialBalance TB records, null or empty when not supplied
     * @param glActivity GL records, null or empty when not supplied
     * @param statementYearCount number of statement years the merge will produce
     * @param strict whether a missing opening snapshot is critical
     */
    public List<ValidationIssue> validateDatasets(List<LedgerRecord> trialBalance,
                                                  List<LedgerRecord> glActivity,
                                                  int statementYearCount,
                                                  boolean strict) {
        boolean hasTb = trialBalance != null && !trialBalance.isEmpty();
        boolean hasGl = glActivity != null && !glActivity.isEmpty();

        List<ValidationIssue> issues = new ArrayList<>();
        if (!hasTb && !hasGl) {
            issues.add(ValidationIssue.builder()
                .severity(Severity.CRITICAL)
                .category("Missing Data")
                .issue("Neither a trial balance nor GL activity was supplied")
                .impact("No financial statements can be produced")
                .suggestion("Supply a trial balance, GL activity, or both")
                .affectedRows(List.of())
                .build());
            return issues;
        }

        if (hasTb) {
            issues.addAll(validateTrialBalance(trialBalance));
            issues.addAll(validateCommonIssues(trialBalance, DatasetType.TRIAL_BALANCE));
        }
        if (hasGl) {
            issues.addAll(validateGlActivity(glActivity));
            issues.addAll(validateCommonIssues(glActivity, DatasetType.GL_ACTIVITY));
        }
        if (hasTb && hasGl) {
            checkOpeningSnapshot(trialBalance, glActivity, statementYearCount, strict).ifPresent(issues::add);
        }

        log.info("Validation complete: issues={}, critical={}",
            issues.size(), issues.stream().filter(ValidationIssue::isCritical).count());
        return issues;
    }

    /**
     * Each snapshot date, and the file as a whole, must balance.
     */
    public List<ValidationIssue> validateTrialBalance(List<LedgerRecord> records) {
        List<ValidationIssue> issues = new ArrayList<>();

        SortedMap<LocalDate, BigDecimal[]> byDate = new TreeMap<>();
        for (LedgerRecord record : records) {
            if (!record.hasDate()) {
                continue;
            }
            BigDecimal[] totals = byDate.computeIfAbsent(record.getTxnDate(),
                date -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            totals[0] = totals[0].add(record.getDebit());
            totals[1] = totals[1].add(record.getCredit());
        }

        List<LocalDate> unbalanced = byDate.entrySet().stream()
            .filter(entry -> tolerance.isOutOfBalance(entry.getValue()[0], entry.getValue()[1]))
            .map(Map.Entry::getKey)
            .toList();

        if (!unbalanced.isEmpty()) {
            issues.add(ValidationIssue.builder()
                .severity(Severity.CRITICAL)
                .category("Trial Balance")
                .dataset(DatasetType.TRIAL_BALANCE)
                .issue(String.format("TB does not balance for %d period(s)", unbalanced.size()))
                .impact("Financial statements will be inaccurate")
                .suggestion("Review source data for these periods")
                .affectedRows(List.of())
                .totalAffected(unbalanced.size())
                .detail("Periods out of balance: " + unbalanced)
                .build());
        }

        overallBalance(records, Severity.CRITICAL, "Trial Balance", "TB", DatasetType.TRIAL_BALANCE)
            .ifPresent(issues::add);
        return issues;
    }

    /**
     * Transactions must balance by id when ids cover at least half of the
     * rows; otherwise only the overall totals are checked.
     */
    public List<ValidationIssue> validateGlActivity(List<LedgerRecord> records) {
        List<ValidationIssue> issues = new ArrayList<>();

        long withId = records.stream().filter(LedgerRecord::hasTransactionId).count();
        boolean useTransactionIds = withId > 0;

        if (withId == 0) {
            issues.add(ValidationIssue.builder()
                .severity(Severity.INFO)
                .category("Data Quality")
                .dataset(DatasetType.GL_ACTIVITY)
                .issue("TransactionID not found")
                .impact("Transaction-level balancing unavailable")
                .suggestion("Using total-file balancing only (weaker validation)")
                .affectedRows(List.of())
                .build());
        } else if ((double) withId / records.size() < MIN_TRANSACTION_ID_COVERAGE) {
            issues.add(ValidationIssue.builder()
                .severity(Severity.WARNING)
                .category("Data Quality")
                .dataset(DatasetType.GL_ACTIVITY)
                .issue(String.format("TransactionID exists but only %.0f%% populated",
                    100.0 * withId / records.size()))
                .impact("Transaction-level balancing unavailable")
                .suggestion("Using total-file balancing only")
                .affectedRows(List.of())
                .build());
            useTransactionIds = false;
        }

        if (useTransactionIds) {
            Map<String, BigDecimal[]> byTransaction = new LinkedHashMap<>();
            for (LedgerRecord record : records) {
                if (!record.hasTransactionId()) {
                    continue;
                }
                BigDecimal[] totals = byTransaction.computeIfAbsent(record.getTransactionId(),
                    id -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
                totals[0] = totals[0].add(record.getDebit());
                totals[1] = totals[1].add(record.getCredit());
            }

            List<String> unbalanced = byTransaction.entrySet().stream()
                .filter(entry -> tolerance.isOutOfBalance(entry.getValue()[0], entry.getValue()[1]))
                .map(Map.Entry::getKey)
                .toList();

            if (!unbalanced.isEmpty()) {
                issues.add(ValidationIssue.builder()
                    .severity(Severity.CRITICAL)
                    .category("Transaction Balance")
                    .dataset(DatasetType.GL_ACTIVITY)
                    .issue(String.format("%d transaction(s) do not balance", unbalanced.size()))
                    .impact("Debits do not equal credits for these transactions")
                    .suggestion("Review and correct these transactions")
                    .affectedRows(List.of())
                    .totalAffected(unbalanced.size())
                    .detail("Unbalanced transactions: " + unbalanced.stream().limit(20).toList())
                    .build());
            }
        }

        Severity overallSeverity = useTransactionIds ? Severity.WARNING : Severity.CRITICAL;
        overallBalance(records, overallSeverity, "Overall Balance", "GL", DatasetType.GL_ACTIVITY)
            .ifPresent(issues::add);
        return issues;
    }

    /**
     * Missing or invalid fields, duplicates, future dates and outliers.
     */
    public List<ValidationIssue> validateCommonIssues(List<LedgerRecord> records, DatasetType dataset) {
        List<ValidationIssue> issues = new ArrayList<>();
        LocalDate today = LocalDate.now(clock);

        rowIssue(records, record -> !record.hasDate(), dataset)
            .map(builder -> builder
                .severity(Severity.WARNING)
                .category("Missing Data")
                .issue(count(builder) + " transactions missing dates")
                .impact("Cannot determine period")
                .suggestion("Remove " + count(builder) + " rows")
                .autoFix(AutoFix.REMOVE_MISSING_DATES)
                .build())
            .ifPresent(issues::add);

        rowIssue(records, record -> record.getAccountNumber() == null, dataset)
            .map(builder -> builder
                .severity(Severity.CRITICAL)
                .category("Missing Data")
                .issue(count(builder) + " transactions without account numbers")
                .impact("Cannot categorize by account range")
                .suggestion("Map to Unclassified (" + UNCLASSIFIED_ACCOUNT_NUMBER + ")")
                .autoFix(AutoFix.MAP_UNCLASSIFIED)
                .build())
            .ifPresent(issues::add);

        rowIssue(records, InputValidator::hasInvalidAccountNumber, dataset)
            .map(builder -> builder
                .severity(Severity.CRITICAL)
                .category("Data Quality")
                .issue(count(builder) + " invalid account numbers")
                .impact("Mapping errors")
                .suggestion("Convert negative to positive")
                .autoFix(AutoFix.FIX_ACCOUNT_NUMBERS)
                .build())
            .ifPresent(issues::add);

        Set<Integer> duplicateRows = duplicateRows(records);
        rowIssue(records, duplicateRows, dataset)
            .map(builder -> builder
                .severity(Severity.WARNING)
                .category("Duplicates")
                .issue(count(builder) + " duplicate transaction lines")
                .impact("May inflate amounts")
                .suggestion("Keep the first of each identical line")
                .autoFix(AutoFix.REMOVE_DUPLICATES)
                .build())
            .ifPresent(issues::add);

        rowIssue(records, record -> record.hasDate() && record.getTxnDate().isAfter(today), dataset)
            .map(builder -> builder
                .severity(Severity.WARNING)
                .category("Data Quality")
                .issue(count(builder) + " future-dated transactions")
                .impact("May affect current period")
                .suggestion("Remove " + count(builder) + " rows")
                .autoFix(AutoFix.REMOVE_FUTURE_DATES)
                .build())
            .ifPresent(issues::add);

        outlierPredicate(records)
            .flatMap(isOutlier -> rowIssue(records, isOutlier, dataset))
            .map(builder -> builder
                .severity(Severity.INFO)
                .category("Outliers")
                .issue(count(builder) + " potential outlier transactions")
                .impact("Unusual amounts detected")
                .suggestion("Review for accuracy")
                .build())
            .ifPresent(issues::add);

        return issues;
    }

    /**
     * Reports when the trial balance lacks the snapshot for the year before
     * the first statement year.
     */
    public Optional<ValidationIssue> checkOpeningSnapshot(List<LedgerRecord> trialBalance,
                                                         List<LedgerRecord> glActivity,
                                                         int statementYearCount,
                                                         boolean strict) {
        Set<Integer> tbYears = years(trialBalance);
        TreeSet<Integer> allYears = new TreeSet<>(tbYears);
        allYears.addAll(years(glActivity));
        if (allYears.isEmpty() || statementYearCount <= 0) {
            return Optional.empty();
        }

        List<Integer> ordered = new ArrayList<>(allYears);
        int firstStatementYear = ordered.get(Math.max(0, ordered.size() - statementYearCount));
        int openingYear = firstStatementYear - 1;
        if (tbYears.contains(openingYear)) {
            return Optional.empty();
        }

        return Optional.of(ValidationIssue.builder()
            .severity(strict ? Severity.CRITICAL : Severity.WARNING)
            .category("Opening Balances")
            .dataset(DatasetType.TRIAL_BALANCE)
            .issue(String.format("Missing Year 0 opening snapshot for %d", openingYear))
            .impact(String.format("Opening balances for first statement year %d are unavailable", firstStatementYear))
            .suggestion(String.format("Include the %d year-end trial balance", openingYear))
            .affectedRows(List.of())
            .build());
    }

    /**
     * Applies the selected fixes in a fixed order: undated rows, missing
     * account numbers, negative account numbers, duplicates, future dates.
     */
    public AutoFixResult applyAutoFixes(List<LedgerRecord> records, Set<AutoFix> fixes) {
        List<LedgerRecord> fixed = new ArrayList<>(records);
        List<String> changes = new ArrayList<>();

        if (fixes.contains(AutoFix.REMOVE_MISSING_DATES)) {
            int before = fixed.size();
            fixed.removeIf(record -> !record.hasDate());
            logChange(changes, before - fixed.size(), "Removed %d rows with missing dates");
        }

        if (fixes.contains(AutoFix.MAP_UNCLASSIFIED)) {
            int mapped = 0;
            for (int i = 0; i < fixed.size(); i++) {
                if (fixed.get(i).getAccountNumber() == null) {
                    fixed.set(i, fixed.get(i).withAccountNumber(UNCLASSIFIED_ACCOUNT_NUMBER));
                    mapped++;
                }
            }
            logChange(changes, mapped, "Mapped %d entries to Unclassified (" + UNCLASSIFIED_ACCOUNT_NUMBER + ")");
        }

        if (fixes.contains(AutoFix.FIX_ACCOUNT_NUMBERS)) {
            int repaired = 0;
            for (int i = 0; i < fixed.size(); i++) {
                LedgerRecord record = fixed.get(i);
                // Numbers above the limit have no safe repair and stay flagged
                if (hasInvalidAccountNumber(record) && record.getAccountNumber() < 0) {
                    fixed.set(i, record.withAccountNumber(Math.abs(record.getAccountNumber())));
                    repaired++;
                }
            }
            logChange(changes, repaired, "Fixed %d invalid account numbers");
        }

        if (fixes.contains(AutoFix.REMOVE_DUPLICATES)) {
            Set<Integer> duplicates = duplicateRows(fixed);
            Set<LedgerRecord> kept = new HashSet<>();
            List<LedgerRecord> deduplicated = new ArrayList<>();
            for (int i = 0; i < fixed.size(); i++) {
                LedgerRecord record = fixed.get(i);
                if (!duplicates.contains(i) || kept.add(duplicateKey(record))) {
                    deduplicated.add(record);
                }
            }
            logChange(changes, fixed.size() - deduplicated.size(), "Removed %d duplicate transactions");
            fixed = deduplicated;
        }

        if (fixes.contains(AutoFix.REMOVE_FUTURE_DATES)) {
            LocalDate today = LocalDate.now(clock);
            int before = fixed.size();
            fixed.removeIf(record -> record.hasDate() && record.getTxnDate().isAfter(today));
            logChange(changes, before - fixed.size(), "Removed %d future-dated transactions");
        }

        changes.forEach(change -> log.info("Auto-fix applied: {}", change));
        return new AutoFixResult(List.copyOf(fixed), List.copyOf(changes));
    }

    private Optional<ValidationIssue> overallBalance(List<LedgerRecord> records, Severity severity,
                                                     String category, String label, DatasetType dataset) {
        BigDecimal totalDebit = records.stream().map(LedgerRecord::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalCredit = records.stream().map(LedgerRecord::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (!tolerance.isOutOfBalance(totalDebit, totalCredit)) {
            return Optional.empty();
        }

        BigDecimal difference = totalDebit.subtract(totalCredit).abs();
        return Optional.of(ValidationIssue.builder()
            .severity(severity)
            .category(category)
            .dataset(dataset)
            .issue(String.format("Overall %s out of balance by %,.2f", label, difference))
            .impact(String.format("Total Debits: %,.2f does not equal Total Credits: %,.2f", totalDebit, totalCredit))
            .suggestion("Review all entries")
            .affectedRows(List.of())
            .build());
    }

    private Optional<ValidationIssue.ValidationIssueBuilder> rowIssue(List<LedgerRecord> records,
                                                                      Predicate<LedgerRecord> affected,
                                                                      DatasetType dataset) {
        Set<Integer> rows = IntStream.range(0, records.size())
            .filter(i -> affected.test(records.get(i)))
            .boxed()
            .collect(Collectors.toCollection(TreeSet::new));
        return rowIssue(records, rows, dataset);
    }

    private Optional<ValidationIssue.ValidationIssueBuilder> rowIssue(List<LedgerRecord> records,
                                                                      Set<Integer> rows,
                                                                      DatasetType dataset) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ValidationIssue.builder()
            .dataset(dataset)
            .affectedRows(rows.stream().sorted().limit(ValidationIssue.MAX_AFFECTED_ROWS).toList())
            .totalAffected(rows.size()));
    }

    private static int count(ValidationIssue.ValidationIssueBuilder builder) {
        return builder.build().getTotalAffected();
    }

    private static boolean hasInvalidAccountNumber(LedgerRecord record) {
        Integer number = record.getAccountNumber();
        return number != null && (number < 0 || number > MAX_ACCOUNT_NUMBER);
    }

    /**
     * Rows carrying a transaction id that are identical to another row.
     * Lines of one multi-line posting share an id but differ in account or
     * amount, so they are not duplicates.
     */
    private static Set<Integer> duplicateRows(List<LedgerRecord> records) {
        Map<LedgerRecord, List<Integer>> occurrences = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            LedgerRecord record = records.get(i);
            if (record.hasTransactionId()) {
                occurrences.computeIfAbsent(duplicateKey(record), r -> new ArrayList<>()).add(i);
            }
        }
        return occurrences.values().stream()
            .filter(rows -> rows.size() > 1)
            .flatMap(List::stream)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Amounts compare by value, so 100 and 100.00 are the same.
     */
    private static LedgerRecord duplicateKey(LedgerRecord record) {
        return record
            .withDebit(record.getDebit().stripTrailingZeros())
            .withCredit(record.getCredit().stripTrailingZeros());
    }

    /**
     * Debit amounts beyond mean + 3 sample standard deviations.
     */
    private static Optional<Predicate<LedgerRecord>> outlierPredicate(List<LedgerRecord> records) {
        if (records.size() < 2) {
            return Optional.empty();
        }
        double[] amounts = records.stream().mapToDouble(record -> record.getDebit().abs().doubleValue()).toArray();
        double mean = 0;
        for (double amount : amounts) {
            mean += amount;
        }
        mean /= amounts.length;

        double squares = 0;
        for (double amount : amounts) {
            squares += (amount - mean) * (amount - mean);
        }
        double threshold = mean + 3 * Math.sqrt(squares / (amounts.length - 1));
        return Optional.of(record -> record.getDebit().abs().doubleValue() > threshold);
    }

    private static Set<Integer> years(List<LedgerRecord> records) {
        if (records == null) {
            return Set.of();
        }
        return records.stream()
            .filter(LedgerRecord::hasDate)
            .map(record -> record.getTxnDate().getYear())
            .collect(Collectors.toSet());
    }

    private static void logChange(List<String> changes, int count, String template) {
        if (count > 0) {
            changes.add(String.format(template, count));
        }
    }
}
