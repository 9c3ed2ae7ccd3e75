package com.flagship.classroom_ledger.observability;

import java.util.UUID;

/**
 * Per-thread trace id for a single HTTP request or scheduler pass, plus the
 * MDC keys the log pattern prints.
 *
 * Tenant scope does not live here: it is a TenantScope argument.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String CLAIM_ID_MDC_KEY = "claimId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";

    private static final int SHORT_ID_LENGTH = 8;

    private static final ThreadLocal<String> CURRENT = ThreadLocal.withInitial(CorrelationContext::generateCorrelationId);

    private CorrelationContext() {
    }

    /** Current trace id; a scheduler thread gets a fresh one on first use. */
    public static String getCorrelationId() {
        return CURRENT.get();
    }

    public static void setCorrelationId(String id) {
        CURRENT.set(id == null || id.isBlank() ? generateCorrelationId() : id);
    }

    public static void clear() {
        CURRENT.remove();
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, SHORT_ID_LENGTH);
    }
}
