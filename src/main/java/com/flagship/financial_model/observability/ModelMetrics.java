package com.flagship.financial_model.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for model generation.
 *
 * Metrics exposed:
 * - model.generated: models produced, tagged by outcome and source
 * - model.records.classified: ledger records classified, tagged mapped/unclassified
 * - model.reconciliation.breach: statement years whose checks exceed tolerance, tagged by check
 * - model.validation.issues: issues reported, tagged by severity
 * - model.generation.duration: end-to-end generation time
 */
@Component
public class ModelMetrics {

    private final MeterRegistry registry;
    private final Timer generationTimer;

    public ModelMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.generationTimer = Timer.builder("model.generation.duration")
                .description("Time taken to generate a financial model")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * @param outcome success, validation_error, missing_opening_snapshot, ...
     * @param source merged, trial_balance or gl_activity
     */
    public void recordModelGenerated(String outcome, String source) {
        registry.counter("model.generated",
                "outcome", sanitizeTag(outcome),
                "source", sanitizeTag(source)
        ).increment();
    }

    public void recordRecordsClassified(int mapped, int unclassified) {
        Counter.builder("model.records.classified")
                .tag("result", "mapped")
                .register(registry)
                .increment(mapped);
        Counter.builder("model.records.classified")
                .tag("result", "unclassified")
                .register(registry)
                .increment(unclassified);
    }

    public void recordReconciliationBreach(String check) {
        registry.counter("model.reconciliation.breach", "check", sanitizeTag(check)).increment();
    }

    public void recordValidationIssue(String severity) {
        registry.counter("model.validation.issues", "severity", sanitizeTag(severity)).increment();
    }

    public void recordGenerationDuration(Duration duration) {
        generationTimer.record(duration);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
