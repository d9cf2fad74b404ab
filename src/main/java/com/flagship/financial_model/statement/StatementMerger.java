package com.flagship.financial_model.statement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines trial-balance snapshots (balance sheet) with GL activity
 * (income statement) into one statement series.
 *
 * The output covers the latest N years of the combined range plus an
 * internal Year0, the year before the first statement year. Year0 must
 * exist in the trial balance: its balances open the first statement year.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementMerger {

    public static final int DEFAULT_STATEMENT_YEAR_COUNT = 3;

    private static final List<LineItem> BALANCE_SHEET_ITEMS = LineItem.inSection(LineItem.Section.BALANCE_SHEET);
    private static final List<LineItem> INCOME_STATEMENT_ITEMS = LineItem.inSection(LineItem.Section.INCOME_STATEMENT);

    private final CashFlowDeriver cashFlowDeriver;

    public StatementSeries merge(Map<Integer, YearStatement> trialBalance, Map<Integer, YearStatement> glActivity) {
        return merge(trialBalance, glActivity, DEFAULT_STATEMENT_YEAR_COUNT);
    }

    /**
     * Merges the two sources.
     *
     * @throws MissingOpeningSnapshotException if the trial balance lacks Year0
     * @throws IllegalArgumentException if statementYearCount is not positive
     */
    public StatementSeries merge(Map<Integer, YearStatement> trialBalance,
                                 Map<Integer, YearStatement> glActivity,
                                 int statementYearCount) {
        if (statementYearCount <= 0) {
            throw new IllegalArgumentException("Statement year count must be positive: " + statementYearCount);
        }
        Map<Integer, YearStatement> tb = trialBalance != null ? trialBalance : Collections.emptyMap();
        Map<Integer, YearStatement> gl = glActivity != null ? glActivity : Collections.emptyMap();

        TreeSet<Integer> allYears = new TreeSet<>(tb.keySet());
        allYears.addAll(gl.keySet());
        if (allYears.isEmpty()) {
            return StatementSeries.empty();
        }

        List<Integer> years = new ArrayList<>(allYears);
        List<Integer> statementYears = years.subList(Math.max(0, years.size() - statementYearCount), years.size());
        int firstStatementYear = statementYears.get(0);
        int openingYear = firstStatementYear - 1;

        if (!tb.containsKey(openingYear)) {
            throw new MissingOpeningSnapshotException(openingYear, firstStatementYear);
        }

        SortedMap<Integer, YearStatement> combined = new TreeMap<>();
        combined.put(openingYear, openingStatement(tb.get(openingYear)));
        for (int year : statementYears) {
            combined.put(year, statementYear(year, tb.get(year), gl.get(year)));
        }

        YearStatement prior = combined.get(openingYear);
        for (int year : statementYears) {
            YearStatement current = combined.get(year);
            cashFlowDeriver.deriveDividends(prior, current);
            cashFlowDeriver.deriveBetween(prior, current);
            prior = current;
        }

        log.info("Merged trial balance and GL activity: openingYear={}, statementYears={}",
            openingYear, statementYears);
        return StatementSeries.withOpeningYear(openingYear, combined);
    }

    private YearStatement openingStatement(YearStatement tbStatement) {
        YearStatement opening = tbStatement.copySection(LineItem.Section.BALANCE_SHEET);
        BALANCE_SHEET_ITEMS.forEach(opening::ensure);
        return opening;
    }

    private YearStatement statementYear(int year, YearStatement tbStatement, YearStatement glStatement) {
        YearStatement merged = tbStatement != null ? tbStatement.copy() : new YearStatement(year);

        // Only income-statement items come from GL; its balance-sheet fields are not authoritative
        for (LineItem item : INCOME_STATEMENT_ITEMS) {
            merged.put(item, glStatement != null ? glStatement.get(item) : null);
        }
        merged.computeSubtotals();

        BALANCE_SHEET_ITEMS.forEach(merged::ensure);
        return merged;
    }
}
