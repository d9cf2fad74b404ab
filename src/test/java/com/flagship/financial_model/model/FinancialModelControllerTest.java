package com.flagship.financial_model.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.financial_model.LedgerFixtures;
import com.flagship.financial_model.ledger.LedgerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class FinancialModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static List<Map<String, Object>> toJson(List<LedgerRecord> records) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (LedgerRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("txn_date", record.getTxnDate() != null ? record.getTxnDate().toString() : null);
            row.put("account_number", record.getAccountNumber());
            row.put("account_name", record.getAccountName());
            row.put("debit", record.getDebit().longValueExact());
            row.put("credit", record.getCredit().longValueExact());
            if (record.hasTransactionId()) {
                row.put("transaction_id", record.getTransactionId());
            }
            rows.add(row);
        }
        return rows;
    }

    private String body(List<LedgerRecord> trialBalance, List<LedgerRecord> glActivity, Boolean strict) throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("trial_balance", toJson(trialBalance));
        request.put("gl_activity", toJson(glActivity));
        if (strict != null) {
            request.put("strict", strict);
        }
        return objectMapper.writeValueAsString(request);
    }

    @Test
    @DisplayName("POST /api/financial-model - builds the three-statement model")
    void testGenerateModel() throws Exception {
        printTestHeader("POST /api/financial-model");

        mockMvc.perform(post("/api/financial-model")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(LedgerFixtures.trialBalance(), LedgerFixtures.glActivity(), true)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("merged"))
            .andExpect(jsonPath("$.opening_year").value(2021))
            .andExpect(jsonPath("$.statement_years", hasSize(3)))
            .andExpect(jsonPath("$.statement_years[0]").value(2022))
            .andExpect(jsonPath("$.statements['2021']").doesNotExist())
            .andExpect(jsonPath("$.statements['2022'].net_income").value(670))
            .andExpect(jsonPath("$.statements['2022'].dividends").value(640))
            .andExpect(jsonPath("$.reconciled").value(true))
            .andExpect(jsonPath("$.mapping_stats.mapping_rate").value(1.0))
            .andExpect(jsonPath("$.reports.income_statement").exists())
            .andExpect(jsonPath("$.key_ratios['2022']").exists());

        printSuccess("Model returned");
    }

    @Test
    @DisplayName("POST /api/financial-model - missing opening snapshot returns 422")
    void testMissingOpeningSnapshot() throws Exception {
        printTestHeader("Missing Opening Snapshot");

        mockMvc.perform(post("/api/financial-model")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(LedgerFixtures.trialBalance(1, 3), LedgerFixtures.glActivity(1, 3), false)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("Missing Opening Snapshot"))
            .andExpect(jsonPath("$.details.opening_year").exists());

        printSuccess("422 returned");
    }

    @Test
    @DisplayName("POST /api/financial-model - strict mode reports critical issues as 400")
    void testStrictModeRejects() throws Exception {
        printTestHeader("Strict Mode");

        mockMvc.perform(post("/api/financial-model")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(LedgerFixtures.trialBalance(1, 3), LedgerFixtures.glActivity(1, 3), true)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Input Validation Failed"))
            .andExpect(jsonPath("$.issues[?(@.category == 'Opening Balances')]").exists());

        printSuccess("400 returned");
    }

    @Test
    @DisplayName("POST /api/financial-model - no datasets returns 400")
    void testNoDatasets() throws Exception {
        printTestHeader("No Datasets");

        mockMvc.perform(post("/api/financial-model")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(List.of(), List.of(), null)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Dataset"));

        printSuccess("400 returned");
    }

    @Test
    @DisplayName("POST /api/financial-model - negative amounts fail bean validation")
    void testNegativeAmount() throws Exception {
        printTestHeader("Negative Amount");

        String request = """
            {
              "trial_balance": [
                {"txn_date": "2023-12-31", "account_number": 1000, "account_name": "Cash", "debit": -5, "credit": 0}
              ]
            }
            """;

        mockMvc.perform(post("/api/financial-model")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"));

        printSuccess("400 returned");
    }

    @Test
    @DisplayName("POST /api/financial-model/validate - unbalanced trial balance is invalid")
    void testValidateUnbalanced() throws Exception {
        printTestHeader("POST /api/financial-model/validate");

        List<LedgerRecord> trialBalance = new ArrayList<>(LedgerFixtures.trialBalance());
        trialBalance.add(LedgerFixtures.debit(LocalDate.of(2024, 12, 31), 1000, "Cash", 25));

        mockMvc.perform(post("/api/financial-model/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(trialBalance, LedgerFixtures.glActivity(), null)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.issues[?(@.category == 'Trial Balance')]").exists());

        printSuccess("Imbalance reported");
    }

    @Test
    @DisplayName("POST /api/financial-model/classify - accrued payroll wins over ranges")
    void testClassify() throws Exception {
        printTestHeader("POST /api/financial-model/classify");

        String request = """
            {
              "records": [
                {"account_number": 2600, "account_name": "Accrued Payroll", "debit": 0, "credit": 10},
                {"account_number": 1000, "account_name": "Cash", "debit": 10, "credit": 0}
              ]
            }
            """;

        mockMvc.perform(post("/api/financial-model/classify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.records[0].category").value("accrued_payroll"))
            .andExpect(jsonPath("$.records[1].category").value("cash"))
            .andExpect(jsonPath("$.mapping_stats.total_accounts").value(2));

        printSuccess("Records classified");
    }

    @Test
    @DisplayName("Correlation id is echoed back")
    void testCorrelationIdEchoed() throws Exception {
        printTestHeader("Correlation ID");

        mockMvc.perform(post("/api/financial-model/validate")
                .header("X-Correlation-ID", "test-correlation-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(LedgerFixtures.trialBalance(), LedgerFixtures.glActivity(), null)))
            .andExpect(status().isOk())
            .andExpect(header().string("X-Correlation-ID", "test-correlation-123"));

        printSuccess("Header echoed");
    }
}
