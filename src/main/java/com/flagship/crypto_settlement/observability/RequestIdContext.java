package com.flagship.crypto_settlement.observability;

import java.util.UUID;

/**
 * MDC keys and the request id header.
 *
 * {@code requestId} identifies one HTTP request. {@code invoiceId} and
 * {@code correlationId} (the on-chain payment's correlation id) are set by
 * the settlement services for the span of one settlement.
 */
public final class RequestIdContext {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private RequestIdContext() {
    }

    public static String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
