package com.flagship.financial_model.model;

import com.flagship.financial_model.LedgerFixtures;
import com.flagship.financial_model.classification.AccountRange;
import com.flagship.financial_model.classification.FsliCategory;
import com.flagship.financial_model.ledger.LedgerRecord;
import com.flagship.financial_model.report.StatementLayout;
import com.flagship.financial_model.statement.LineItem;
import com.flagship.financial_model.statement.MissingOpeningSnapshotException;
import com.flagship.financial_model.validation.AutoFix;
import com.flagship.financial_model.validation.InputValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flagship.financial_model.LedgerFixtures.debit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end model generation through the Spring context.
 */
@SpringBootTest
class FinancialModelServiceTest {

    @Autowired
    private FinancialModelService modelService;

    @Autowired
    private MeterRegistry meterRegistry;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "Expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Trial balance and GL produce reconciled three-year statements")
    void testMergedModel() {
        printTestHeader("Merged Model");

        // Given
        ModelRequestContext context = ModelRequestContext.builder()
            .trialBalance(LedgerFixtures.trialBalance())
            .glActivity(LedgerFixtures.glActivity())
            .strict(true)
            .build();
        printInput("TB records", context.getTrialBalance().size());
        printInput("GL records", context.getGlActivity().size());

        // When
        FinancialModelResult result = modelService.generate(context);
        printOutput("Statement years", result.getStatementYears());
        printOutput("Reconciliation", result.getReconciliation());

        // Then
        assertEquals(ModelSource.MERGED, result.getSource());
        assertEquals(2021, result.getOpeningYear());
        assertEquals(List.of(2022, 2023, 2024), result.getStatementYears());
        assertFalse(result.getStatements().containsKey(2021), "Opening year must not be shown");
        assertTrue(result.isReconciled());

        assertAmount("670", result.getStatements().get(2022).get(LineItem.NET_INCOME));
        assertAmount("640", result.getStatements().get(2022).get(LineItem.DIVIDENDS));
        assertAmount("670", result.getReports().get(StatementLayout.INCOME_STATEMENT)
            .valueOf("Net Income", 2022).orElseThrow());
        assertAmount("60.9091", result.getKeyRatios().get(2022).getGrossMarginPct());
        assertEquals(1.0, result.getMappingStats().getMappingRate(), 1e-9);
        printSuccess("Merged model reconciled");
    }

    @Test
    @DisplayName("Trial balance alone falls back to the single-source path")
    void testTrialBalanceOnly() {
        printTestHeader("Trial Balance Only");

        FinancialModelResult result = modelService.generate(ModelRequestContext.builder()
            .trialBalance(LedgerFixtures.trialBalance())
            .build());
        printOutput("Years", result.getStatementYears());

        assertEquals(ModelSource.TRIAL_BALANCE_ONLY, result.getSource());
        assertNull(result.getOpeningYear());
        assertEquals(List.of(2021, 2022, 2023, 2024), result.getStatementYears());
        assertAmount("-10", result.getStatements().get(2022).get(LineItem.DELTA_AR));
        assertAmount("0", result.getStatements().get(2021).get(LineItem.DELTA_AR));
        printSuccess("Single-source statements produced");
    }

    @Test
    @DisplayName("GL alone produces income statements per year")
    void testGlOnly() {
        printTestHeader("GL Only");

        FinancialModelResult result = modelService.generate(ModelRequestContext.builder()
            .glActivity(LedgerFixtures.glActivity())
            .build());

        assertEquals(ModelSource.GL_ACTIVITY_ONLY, result.getSource());
        assertAmount("880", result.getStatements().get(2024).get(LineItem.NET_INCOME));
        printSuccess("GL-only statements produced");
    }

    @Test
    @DisplayName("No datasets is rejected")
    void testNoDatasets() {
        printTestHeader("No Datasets");
        printExpectedException("MissingDatasetException", "Both datasets empty");

        assertThrows(MissingDatasetException.class,
            () -> modelService.generate(ModelRequestContext.builder().build()));
        printSuccess("Rejected");
    }

    @Test
    @DisplayName("Missing opening snapshot is rejected in strict mode by validation")
    void testStrictMissingOpeningSnapshot() {
        printTestHeader("Strict Missing Opening Snapshot");

        ModelRequestContext context = ModelRequestContext.builder()
            .trialBalance(LedgerFixtures.trialBalance(1, 3))
            .glActivity(LedgerFixtures.glActivity(1, 3))
            .strict(true)
            .build();

        InputValidationException e = assertThrows(InputValidationException.class, () -> modelService.generate(context));
        printOutput("Message", e.getMessage());
        assertTrue(e.getIssues().stream().anyMatch(issue -> "Opening Balances".equals(issue.getCategory())));
        printSuccess("Strict mode stopped the run");
    }

    @Test
    @DisplayName("Missing opening snapshot still stops the merge outside strict mode")
    void testLenientMissingOpeningSnapshot() {
        printTestHeader("Lenient Missing Opening Snapshot");

        ModelRequestContext context = ModelRequestContext.builder()
            .trialBalance(LedgerFixtures.trialBalance(1, 3))
            .glActivity(LedgerFixtures.glActivity(1, 3))
            .build();

        double before = meterRegistry.counter("model.generated",
            "outcome", "missing_opening_snapshot", "source", "merged").count();

        assertThrows(MissingOpeningSnapshotException.class, () -> modelService.generate(context));

        double after = meterRegistry.counter("model.generated",
            "outcome", "missing_opening_snapshot", "source", "merged").count();
        assertEquals(before + 1, after);
        printSuccess("Merge refused and counted");
    }

    @Test
    @DisplayName("Auto-fixes run before validation and are reported")
    void testAutoFixes() {
        printTestHeader("Auto Fixes");

        List<LedgerRecord> tb = new ArrayList<>(LedgerFixtures.trialBalance());
        tb.add(debit(null, 1000, "Cash", 10));

        FinancialModelResult result = modelService.generate(ModelRequestContext.builder()
            .trialBalance(tb)
            .glActivity(LedgerFixtures.glActivity())
            .autoFixes(Set.of(AutoFix.REMOVE_MISSING_DATES))
            .build());
        printOutput("Changes", result.getAutoFixChanges());

        assertEquals(List.of("Removed 1 rows with missing dates"), result.getAutoFixChanges());
        assertTrue(result.getIssues().stream().noneMatch(issue -> issue.getAutoFix() == AutoFix.REMOVE_MISSING_DATES));
        printSuccess("Fix applied");
    }

    @Test
    @DisplayName("Custom ranges change classification of unnamed accounts")
    void testCustomRanges() {
        printTestHeader("Custom Ranges");

        LocalDate yearEnd = LocalDate.of(2023, 12, 31);
        List<LedgerRecord> tb = List.of(
            debit(yearEnd, 10, null, 75),
            LedgerFixtures.credit(yearEnd, 3000, "Owner Equity", 75)
        );

        FinancialModelResult result = modelService.generate(ModelRequestContext.builder()
            .trialBalance(tb)
            .customRanges(Map.of(
                FsliCategory.CASH, AccountRange.of(1, 99),
                FsliCategory.COMMON_STOCK, AccountRange.of(3000, 3099)))
            .build());

        assertAmount("75", result.getStatements().get(2023).get(LineItem.CASH));
        assertAmount("75", result.getStatements().get(2023).get(LineItem.COMMON_STOCK));
        printSuccess("Custom ranges applied");
    }
}
