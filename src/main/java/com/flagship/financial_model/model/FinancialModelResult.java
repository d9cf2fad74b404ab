package com.flagship.financial_model.model;

import com.flagship.financial_model.classification.MappingStats;
import com.flagship.financial_model.reconciliation.ReconciliationResult;
import com.flagship.financial_model.report.KeyRatios;
import com.flagship.financial_model.report.ReportTable;
import com.flagship.financial_model.report.StatementLayout;
import com.flagship.financial_model.statement.YearStatement;
import com.flagship.financial_model.validation.ValidationIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Output of one model run. Statements hold user-visible years only; the
 * opening year, when one was used, is reported but never included.
 */
@Value
@Builder
public class FinancialModelResult {
    ModelSource source;
    Integer openingYear;
    List<Integer> statementYears;
    SortedMap<Integer, YearStatement> statements;
    SortedMap<Integer, ReconciliationResult> reconciliation;
    boolean reconciled;
    MappingStats mappingStats;
    List<ValidationIssue> issues;
    List<String> autoFixChanges;
    Map<StatementLayout, ReportTable> reports;
    SortedMap<Integer, KeyRatios> keyRatios;
}
