package com.flagship.financial_model.observability;

import java.util.UUID;

/**
 * Thread-local correlation ID for the request being modelled.
 *
 * The ID comes from the X-Correlation-ID header or is generated, and is
 * copied into the MDC so every log line of a model run can be grouped.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String DATASETS_MDC_KEY = "datasets";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
