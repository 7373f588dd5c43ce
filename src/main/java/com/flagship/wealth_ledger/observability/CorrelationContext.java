package com.flagship.wealth_ledger.observability;

import java.util.UUID;

/**
 * Correlation header and the MDC keys used across the ledger.
 *
 * The correlation id comes from the X-Correlation-ID request header or is
 * generated, and appears in every log line of the request through the MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String OPERATION_MDC_KEY = "operation";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
