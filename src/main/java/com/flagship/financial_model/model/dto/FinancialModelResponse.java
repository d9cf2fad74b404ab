package com.flagship.financial_model.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.financial_model.classification.MappingStats;
import com.flagship.financial_model.model.FinancialModelResult;
import com.flagship.financial_model.model.ModelSource;
import com.flagship.financial_model.reconciliation.ReconciliationResult;
import com.flagship.financial_model.report.KeyRatios;
import com.flagship.financial_model.report.ReportTable;
import com.flagship.financial_model.statement.YearStatement;
import com.flagship.financial_model.validation.ValidationIssue;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for model generation.
 *
 * A statement year with no prior year carries no cash-flow keys.
 */
@Value
@Builder
public class FinancialModelResponse {

    @JsonProperty("source")
    ModelSource source;

    @JsonProperty("opening_year")
    Integer openingYear;

    @JsonProperty("statement_years")
    List<Integer> statementYears;

    @JsonProperty("statements")
    Map<Integer, YearStatement> statements;

    @JsonProperty("reconciliation")
    Map<Integer, ReconciliationResult> reconciliation;

    @JsonProperty("reconciled")
    boolean reconciled;

    @JsonProperty("mapping_stats")
    MappingStats mappingStats;

    @JsonProperty("validation_issues")
    List<ValidationIssue> validationIssues;

    @JsonProperty("auto_fix_changes")
    List<String> autoFixChanges;

    @JsonProperty("reports")
    Map<String, ReportTable> reports;

    @JsonProperty("key_ratios")
    Map<Integer, KeyRatios> keyRatios;

    public static FinancialModelResponse from(FinancialModelResult result) {
        Map<String, ReportTable> reports = new LinkedHashMap<>();
        result.getReports().forEach((layout, table) -> reports.put(layout.name().toLowerCase(Locale.ROOT), table));

        return FinancialModelResponse.builder()
            .source(result.getSource())
            .openingYear(result.getOpeningYear())
            .statementYears(result.getStatementYears())
            .statements(result.getStatements())
            .reconciliation(result.getReconciliation())
            .reconciled(result.isReconciled())
            .mappingStats(result.getMappingStats())
            .validationIssues(result.getIssues())
            .autoFixChanges(result.getAutoFixChanges())
            .reports(reports)
            .keyRatios(result.getKeyRatios())
            .build();
    }
}
