package com.flagship.financial_model.statement;

import com.flagship.financial_model.classification.ClassifiedRecord;
import com.flagship.financial_model.classification.FsliCategory;
import com.flagship.financial_model.ledger.LedgerRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Aggregates classified records into one {@link YearStatement} per calendar year.
 *
 * Sign conventions:
 * - asset categories: debit minus credit
 * - liability, equity and accumulated depreciation: debit minus credit,
 *   stored as an absolute value
 * - revenue: credits only
 * - cost and expense categories: debits only
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementAggregator {

    private static final Set<FsliCategory> ABSOLUTE_CATEGORIES = EnumSet.of(
        FsliCategory.ACCUMULATED_DEPRECIATION,
        FsliCategory.ACCOUNTS_PAYABLE,
        FsliCategory.ACCRUED_PAYROLL,
        FsliCategory.DEFERRED_REVENUE,
        FsliCategory.INTEREST_PAYABLE,
        FsliCategory.OTHER_CURRENT_LIABILITIES,
        FsliCategory.INCOME_TAXES_PAYABLE,
        FsliCategory.LONG_TERM_DEBT,
        FsliCategory.COMMON_STOCK,
        FsliCategory.RETAINED_EARNINGS
    );

    private final CashFlowDeriver cashFlowDeriver;

    public SortedMap<Integer, YearStatement> aggregate(List<ClassifiedRecord> records, AggregationMode mode) {
        return aggregate(records, mode, UndatedRecordPolicy.DROP_UNDATED);
    }

    /**
     * Builds one statement per distinct year present in the dated records.
     * With two or more years, consecutive-year cash-flow drivers are added.
     */
    public SortedMap<Integer, YearStatement> aggregate(List<ClassifiedRecord> records,
                                                       AggregationMode mode,
                                                       UndatedRecordPolicy undatedPolicy) {
        SortedMap<Integer, List<ClassifiedRecord>> byYear = groupByYear(records, undatedPolicy);

        SortedMap<Integer, YearStatement> statements = new TreeMap<>();
        for (Map.Entry<Integer, List<ClassifiedRecord>> entry : byYear.entrySet()) {
            List<ClassifiedRecord> yearRecords = mode == AggregationMode.SNAPSHOT
                ? latestSnapshot(entry.getValue())
                : entry.getValue();
            statements.put(entry.getKey(), buildStatement(entry.getKey(), yearRecords));
        }

        cashFlowDeriver.deriveSeries(statements);

        log.debug("Aggregated {} records into {} year(s), mode={}", records.size(), statements.size(), mode);
        return statements;
    }

    private SortedMap<Integer, List<ClassifiedRecord>> groupByYear(List<ClassifiedRecord> records,
                                                                   UndatedRecordPolicy undatedPolicy) {
        SortedMap<Integer, List<ClassifiedRecord>> byYear = new TreeMap<>();
        int undated = 0;
        for (ClassifiedRecord record : records) {
            LocalDate date = record.getRecord().getTxnDate();
            if (date == null) {
                undated++;
                continue;
            }
            byYear.computeIfAbsent(date.getYear(), year -> new ArrayList<>()).add(record);
        }

        if (undated > 0) {
            if (undatedPolicy == UndatedRecordPolicy.REJECT_UNDATED) {
                throw new IllegalArgumentException(
                    String.format("%d record(s) have no transaction date", undated));
            }
            log.debug("Dropped {} undated record(s) before aggregation", undated);
        }
        return byYear;
    }

    /**
     * Keeps only the records on the latest date of the year, so monthly
     * snapshots within one year are not summed together.
     */
    private List<ClassifiedRecord> latestSnapshot(List<ClassifiedRecord> yearRecords) {
        LocalDate latest = yearRecords.stream()
            .map(record -> record.getRecord().getTxnDate())
            .max(LocalDate::compareTo)
            .orElseThrow();
        return yearRecords.stream()
            .filter(record -> latest.equals(record.getRecord().getTxnDate()))
            .toList();
    }

    private YearStatement buildStatement(int year, List<ClassifiedRecord> records) {
        YearStatement statement = new YearStatement(year);

        for (LineItem item : LineItem.values()) {
            FsliCategory category = item.getCategory();
            if (category == null) {
                continue;
            }
            statement.put(item, sumCategory(records, category));
        }

        statement.put(LineItem.NET_INCOME, statement.computeSubtotals());
        return statement;
    }

    private BigDecimal sumCategory(List<ClassifiedRecord> records, FsliCategory category) {
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        for (ClassifiedRecord classified : records) {
            if (classified.getCategory() != category) {
                continue;
            }
            LedgerRecord record = classified.getRecord();
            debits = debits.add(record.getDebit());
            credits = credits.add(record.getCredit());
        }

        return switch (category) {
            case REVENUE -> credits;
            case COGS, DISTRIBUTION_EXPENSES, MARKETING_ADMIN, RESEARCH_DEV,
                 DEPRECIATION_EXPENSE, INTEREST_EXPENSE, TAX_EXPENSE -> debits;
            default -> {
                BigDecimal net = debits.subtract(credits);
                yield ABSOLUTE_CATEGORIES.contains(category) ? net.abs() : net;
            }
        };
    }
}
