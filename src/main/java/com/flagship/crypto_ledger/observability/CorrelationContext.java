package com.flagship.crypto_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys every log line may carry.
 *
 * The correlation id comes from the X-Correlation-ID request header (or is
 * generated), is echoed back on the response and travels with outbox events
 * as a Kafka header.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String OFFER_ID_MDC_KEY = "offerId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id; a fresh one is generated for threads outside a request (schedulers).
     */
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

    public static void putAccount(UUID accountId) {
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        }
    }

    public static void putOffer(UUID offerId) {
        if (offerId != null) {
            MDC.put(OFFER_ID_MDC_KEY, offerId.toString());
        }
    }

    /**
     * Clears the thread-local id and every MDC key this class manages.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(OFFER_ID_MDC_KEY);
    }

    /**
     * Short form for readable logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
