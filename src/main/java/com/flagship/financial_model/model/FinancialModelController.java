package com.flagship.financial_model.model;

import com.flagship.financial_model.classification.AccountClassifier;
import com.flagship.financial_model.classification.AccountRangeTable;
import com.flagship.financial_model.classification.ClassifiedRecord;
import com.flagship.financial_model.model.dto.ClassifyRequest;
import com.flagship.financial_model.model.dto.ClassifyResponse;
import com.flagship.financial_model.model.dto.FinancialModelResponse;
import com.flagship.financial_model.model.dto.GenerateModelRequest;
import com.flagship.financial_model.model.dto.LedgerRecordRequest;
import com.flagship.financial_model.model.dto.ValidationResponse;
import com.flagship.financial_model.validation.ValidationIssue;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * REST API for building financial models from ledger data.
 *
 * Request fields left out fall back to the financial-model.* settings.
 */
@RestController
@RequestMapping("/api/financial-model")
@Slf4j
public class FinancialModelController {

    private final FinancialModelService modelService;
    private final AccountClassifier classifier;
    private final int defaultStatementYears;
    private final boolean defaultStrict;
    private final BigDecimal reconciliationTolerance;

    public FinancialModelController(
            FinancialModelService modelService,
            AccountClassifier classifier,
            @Value("${financial-model.statement-years:3}") int defaultStatementYears,
            @Value("${financial-model.strict:false}") boolean defaultStrict,
            @Value("${financial-model.reconciliation.tolerance:0.01}") BigDecimal reconciliationTolerance) {
        this.modelService = modelService;
        this.classifier = classifier;
        this.defaultStatementYears = defaultStatementYears;
        this.defaultStrict = defaultStrict;
        this.reconciliationTolerance = reconciliationTolerance;
    }

    /**
     * Builds statements, reconciliation, reports and ratios.
     */
    @PostMapping
    public ResponseEntity<FinancialModelResponse> generate(@Valid @RequestBody GenerateModelRequest request) {
        ModelRequestContext context = toContext(request);
        log.info("Received model request: tbRecords={}, glRecords={}, statementYears={}, strict={}",
                context.getTrialBalance().size(), context.getGlActivity().size(),
                context.getStatementYears(), context.isStrict());

        FinancialModelResult result = modelService.generate(context);
        return ResponseEntity.ok(FinancialModelResponse.from(result));
    }

    /**
     * Reports validation issues without building the model.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody GenerateModelRequest request) {
        ModelRequestContext context = toContext(request);
        List<ValidationIssue> issues = modelService.validate(context);
        log.info("Validation request complete: issues={}", issues.size());
        return ResponseEntity.ok(ValidationResponse.from(issues));
    }

    /**
     * Classifies each record into a statement line category.
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassifyResponse> classify(@Valid @RequestBody ClassifyRequest request) {
        GenerateModelRequest rangesOnly = GenerateModelRequest.builder()
                .customRanges(request.getCustomRanges())
                .build();
        AccountRangeTable ranges = AccountRangeTable.of(rangesOnly.toRangeMap());

        List<ClassifiedRecord> classified = classifier.classifyAll(
                LedgerRecordRequest.toRecords(request.getRecords()), ranges);
        return ResponseEntity.ok(ClassifyResponse.from(classified, classifier.mappingStats(classified)));
    }

    private ModelRequestContext toContext(GenerateModelRequest request) {
        return ModelRequestContext.builder()
                .trialBalance(LedgerRecordRequest.toRecords(request.getTrialBalance()))
                .glActivity(LedgerRecordRequest.toRecords(request.getGlActivity()))
                .customRanges(request.toRangeMap())
                .statementYears(request.getStatementYears() != null ? request.getStatementYears() : defaultStatementYears)
                .strict(request.getStrict() != null ? request.getStrict() : defaultStrict)
                .autoFixes(request.getAutoFixes() != null ? Set.copyOf(request.getAutoFixes()) : Set.of())
                .reconciliationTolerance(reconciliationTolerance)
                .build();
    }
}
