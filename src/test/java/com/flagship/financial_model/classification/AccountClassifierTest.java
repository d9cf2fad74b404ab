package com.flagship.financial_model.classification;

import com.flagship.financial_model.ledger.LedgerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Account classification: name aliases first, numeric ranges second.
 */
class AccountClassifierTest {

    private AccountClassifier classifier;

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

    @BeforeEach
    void setUp() {
        classifier = new AccountClassifier(ClassificationPolicy.PERMISSIVE_SUBSTRING);
    }

    @Test
    @DisplayName("Name match takes precedence over the account number range")
    void testNameBeatsRange() {
        printTestHeader("Name Precedence");

        // Given: an accrued payroll account numbered inside the long-term debt range
        printInput("Name", "Accrued Payroll");
        printInput("Number", 2600);

        // When
        FsliCategory category = classifier.classify("Accrued Payroll", 2600);
        printOutput("Category", category);

        // Then
        assertEquals(FsliCategory.ACCRUED_PAYROLL, category);
        printSuccess("Name won over range");
    }

    @Test
    @DisplayName("Accrued accounts split on payroll keywords")
    void testAccruedRule() {
        printTestHeader("Accrued Rule");

        assertEquals(FsliCategory.ACCRUED_PAYROLL, classifier.classify("Accrued Wages", null));
        assertEquals(FsliCategory.ACCRUED_PAYROLL, classifier.classify("Accrued Bonus", null));
        assertEquals(FsliCategory.OTHER_CURRENT_LIABILITIES, classifier.classify("Accrued Utilities", null));
        printSuccess("Accrued names routed by keyword");
    }

    @Test
    @DisplayName("Unmatched names fall back to the range table")
    void testRangeFallback() {
        printTestHeader("Range Fallback");

        assertEquals(FsliCategory.COMMON_STOCK, classifier.classify("Owner Equity", 3000));
        assertEquals(FsliCategory.OTHER_OPEX, classifier.classify("Rent Expense", 5400));
        assertEquals(FsliCategory.CASH, classifier.classify(null, 1050));
        assertEquals(FsliCategory.CASH, classifier.classify("   ", 1050));
        printSuccess("Range table used when no alias matches");
    }

    @Test
    @DisplayName("Ampersand abbreviations match their aliases without a number")
    void testAmpersandAbbreviations() {
        printTestHeader("Ampersand Abbreviations");

        // Aliases and names share the same normalization, so '&' reads as 'and' on both sides
        assertEquals(FsliCategory.PPE_GROSS, classifier.classify("PP&E", null));
        assertEquals(FsliCategory.RESEARCH_DEV, classifier.classify("R&D", null));
        assertEquals(FsliCategory.MARKETING_ADMIN, classifier.classify("SG&A", null));
        printSuccess("Abbreviations classified by name");
    }

    @Test
    @DisplayName("No name match and no range yields unclassified")
    void testUnclassified() {
        printTestHeader("Unclassified");

        assertEquals(FsliCategory.UNCLASSIFIED, classifier.classify("Suspense", 99999));
        assertEquals(FsliCategory.UNCLASSIFIED, classifier.classify("Sundry", null));
        printSuccess("Unknown accounts are unclassified");
    }

    @Test
    @DisplayName("Names are normalized before matching")
    void testNormalization() {
        printTestHeader("Normalization");

        printOutput("Normalized", AccountClassifier.normalize("  Cash   &  Cash Equivalents. "));
        assertEquals("cash and cash equivalents", AccountClassifier.normalize("  Cash   &  Cash Equivalents. "));
        assertEquals("", AccountClassifier.normalize(null));
        assertEquals(FsliCategory.ACCOUNTS_RECEIVABLE, classifier.classify("ACCOUNTS   RECEIVABLE", null));
        printSuccess("Case, spacing and punctuation ignored");
    }

    @Test
    @DisplayName("Permissive matching over-matches short aliases; word-boundary matching does not")
    void testPolicies() {
        printTestHeader("Classification Policies");

        AccountClassifier strict = new AccountClassifier(ClassificationPolicy.WORD_BOUNDARY);

        // "retained earnings" contains "ar"
        FsliCategory permissive = classifier.classify("Retained Earnings", 3100);
        FsliCategory wordBoundary = strict.classify("Retained Earnings", 3100);
        printOutput("Permissive", permissive);
        printOutput("Word boundary", wordBoundary);

        assertEquals(FsliCategory.ACCOUNTS_RECEIVABLE, permissive);
        assertEquals(FsliCategory.RETAINED_EARNINGS, wordBoundary);

        // No whole-word alias, so the range decides
        assertEquals(FsliCategory.COGS, strict.classify("Harbor Fees", 5000));
        printSuccess("Policies behave as documented");
    }

    @Test
    @DisplayName("Classification is deterministic")
    void testDeterminism() {
        printTestHeader("Determinism");

        for (int i = 0; i < 5; i++) {
            assertEquals(FsliCategory.PPE_GROSS, classifier.classify("Property Plant and Equipment", 1500));
            assertEquals(FsliCategory.REVENUE, classifier.classify("Sales Revenue", 4000));
        }
        printSuccess("Same input, same category");
    }

    @Test
    @DisplayName("Custom ranges replace the defaults")
    void testCustomRanges() {
        printTestHeader("Custom Ranges");

        Map<FsliCategory, AccountRange> custom = new LinkedHashMap<>();
        custom.put(FsliCategory.REVENUE, AccountRange.of(100, 199));
        AccountRangeTable table = AccountRangeTable.of(custom);

        assertEquals(FsliCategory.REVENUE, classifier.classify(null, 150, table));
        assertEquals(FsliCategory.UNCLASSIFIED, classifier.classify(null, 1000, table));
        assertThrows(IllegalArgumentException.class,
            () -> AccountRangeTable.of(Map.of(FsliCategory.UNCLASSIFIED, AccountRange.of(1, 2))));
        assertThrows(IllegalArgumentException.class, () -> AccountRange.of(10, 5));
        printSuccess("Custom table applied");
    }

    @Test
    @DisplayName("Mapping stats count mapped and unclassified records")
    void testMappingStats() {
        printTestHeader("Mapping Stats");

        LocalDate date = LocalDate.of(2023, 12, 31);
        List<LedgerRecord> records = List.of(
            LedgerRecord.builder().txnDate(date).accountNumber(1000).accountName("Cash").debit(BigDecimal.TEN).build(),
            LedgerRecord.builder().txnDate(date).accountNumber(1100).accountName("Accounts Receivable").debit(BigDecimal.ONE).build(),
            LedgerRecord.builder().txnDate(date).accountNumber(99999).accountName("Suspense").credit(BigDecimal.ONE).build(),
            LedgerRecord.builder().txnDate(date).accountNumber(1010).accountName("Cash").credit(BigDecimal.TEN).build()
        );

        List<ClassifiedRecord> classified = classifier.classifyAll(records, AccountRangeTable.defaults());
        MappingStats stats = classifier.mappingStats(classified);
        printOutput("Stats", stats);

        assertEquals(4, stats.getTotalAccounts());
        assertEquals(3, stats.getMappedAccounts());
        assertEquals(1, stats.getUnclassifiedAccounts());
        assertEquals(0.75, stats.getMappingRate(), 1e-9);
        assertEquals(2, stats.getCategoryDistribution().get(FsliCategory.CASH));
        assertEquals(0, classifier.mappingStats(List.of()).getTotalAccounts());
        printSuccess("Stats computed");
    }
}
