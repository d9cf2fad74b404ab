package com.flagship.financial_model.reconciliation;

import com.flagship.financial_model.LedgerFixtures;
import com.flagship.financial_model.classification.AccountClassifier;
import com.flagship.financial_model.classification.AccountRangeTable;
import com.flagship.financial_model.classification.ClassificationPolicy;
import com.flagship.financial_model.statement.AggregationMode;
import com.flagship.financial_model.statement.CashFlowDeriver;
import com.flagship.financial_model.statement.LineItem;
import com.flagship.financial_model.statement.StatementAggregator;
import com.flagship.financial_model.statement.StatementMerger;
import com.flagship.financial_model.statement.StatementSeries;
import com.flagship.financial_model.statement.YearStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Balance-sheet and cash roll-forward checks on merged statements.
 */
class ReconciliationCheckerTest {

    private final ReconciliationChecker checker = new ReconciliationChecker();
    private StatementSeries series;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        AccountClassifier classifier = new AccountClassifier(ClassificationPolicy.PERMISSIVE_SUBSTRING);
        CashFlowDeriver deriver = new CashFlowDeriver();
        StatementAggregator aggregator = new StatementAggregator(deriver);

        SortedMap<Integer, YearStatement> tb = aggregator.aggregate(
            classifier.classifyAll(LedgerFixtures.trialBalance(), AccountRangeTable.defaults()), AggregationMode.SNAPSHOT);
        SortedMap<Integer, YearStatement> gl = aggregator.aggregate(
            classifier.classifyAll(LedgerFixtures.glActivity(), AccountRangeTable.defaults()), AggregationMode.ACTIVITY);
        series = new StatementMerger(deriver).merge(tb, gl);
    }

    @Test
    @DisplayName("A balanced trial balance reconciles in every statement year")
    void testBalanceInvariant() {
        printTestHeader("Balance Invariant");

        SortedMap<Integer, ReconciliationResult> results = checker.reconcile(series.getStatements());
        printOutput("Results", results);

        assertEquals(List.of(2022, 2023, 2024), List.copyOf(results.keySet()));
        for (ReconciliationResult result : results.values()) {
            assertTrue(result.isBalanceSheetReconciled(ReconciliationChecker.DEFAULT_TOLERANCE),
                "Balance sheet off in " + result.getYear() + ": " + result.getBalanceSheetCheck());
        }
        printSuccess("Assets equal liabilities plus equity");
    }

    @Test
    @DisplayName("Derived cash flows roll opening cash forward to closing cash")
    void testCashRollForward() {
        printTestHeader("Cash Roll-Forward");

        SortedMap<Integer, ReconciliationResult> results = checker.reconcile(series.getStatements());

        for (ReconciliationResult result : results.values()) {
            assertTrue(result.isCashFlowReconciled(ReconciliationChecker.DEFAULT_TOLERANCE),
                "Cash off in " + result.getYear() + ": " + result.getCashflowCheck());
            assertTrue(result.isReconciled(ReconciliationChecker.DEFAULT_TOLERANCE));
        }
        assertEquals(0, BigDecimal.valueOf(20).compareTo(ReconciliationChecker.netCashChange(series.get(2022))));
        printSuccess("Cash ties in every year");
    }

    @Test
    @DisplayName("Retained-earnings roll-forward is reported as a diagnostic")
    void testRetainedEarningsDiagnostics() {
        printTestHeader("Retained Earnings Diagnostics");

        ReconciliationResult result2022 = checker.reconcile(series.getStatements()).get(2022);
        printOutput("2022", result2022);

        // 0 + 670 - 640
        assertEquals(0, BigDecimal.valueOf(30).compareTo(result2022.getRetainedEarningsCalc()));
        assertEquals(0, BigDecimal.valueOf(30).compareTo(result2022.getRetainedEarningsTb()));
        assertEquals(0, result2022.getRetainedEarningsDiff().signum());
        printSuccess("Roll-forward matches TB");
    }

    @Test
    @DisplayName("Imbalances are reported as residuals, not exceptions")
    void testResidualReported() {
        printTestHeader("Residual Reported");

        Map<Integer, YearStatement> statements = new TreeMap<>();
        YearStatement opening = new YearStatement(2022);
        opening.put(LineItem.CASH, BigDecimal.valueOf(100));
        YearStatement current = new YearStatement(2023);
        current.put(LineItem.CASH, BigDecimal.valueOf(150));
        current.put(LineItem.ACCOUNTS_PAYABLE, BigDecimal.valueOf(20));
        statements.put(2022, opening);
        statements.put(2023, current);

        ReconciliationResult result = checker.reconcile(statements).get(2023);
        printOutput("Result", result);

        // 150 - 20 - 0
        assertEquals(0, BigDecimal.valueOf(130).compareTo(result.getBalanceSheetCheck()));
        // 150 - (100 + 0)
        assertEquals(0, BigDecimal.valueOf(50).compareTo(result.getCashflowCheck()));
        assertFalse(result.isReconciled(ReconciliationChecker.DEFAULT_TOLERANCE));
        printSuccess("Residuals reported");
    }

    @Test
    @DisplayName("Fewer than two years gives no results")
    void testTooFewYears() {
        printTestHeader("Too Few Years");

        assertTrue(checker.reconcile(Map.of()).isEmpty());
        assertTrue(checker.reconcile(null).isEmpty());
        assertTrue(checker.reconcile(Map.of(2023, new YearStatement(2023))).isEmpty());
        printSuccess("Empty result");
    }
}
