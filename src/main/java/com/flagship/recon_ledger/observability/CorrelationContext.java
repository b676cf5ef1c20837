package com.flagship.recon_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id of the current request or matcher run, plus the MDC keys the log
 * pattern prints.
 *
 * HTTP requests take the id from {@code X-Correlation-ID} or get a fresh one. Matcher
 * runs started in the background carry their own.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String MATCH_ID_MDC_KEY = "matchId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String TRANSACTION_ID_MDC_KEY = "txnId";

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
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Short ids read better in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Clears the thread-local id and every MDC key owned by this class.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(RUN_ID_MDC_KEY);
        MDC.remove(MATCH_ID_MDC_KEY);
        MDC.remove(ENTRY_ID_MDC_KEY);
        MDC.remove(TRANSACTION_ID_MDC_KEY);
    }
}
