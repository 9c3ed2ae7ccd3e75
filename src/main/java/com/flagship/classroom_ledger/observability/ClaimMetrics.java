package com.flagship.classroom_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for the ledger and the claims engine.
 *
 * Metrics exposed:
 * - ledger.entries.appended / ledger.entries.voided: ledger writes by kind
 * - claims.filed / claims.decided: claim lifecycle, tagged by type and result
 * - claims.failures: business-rule failures by code
 * - claims.payout.amount: distribution of paid-out amounts
 * - integrity.violations: cross-tenant and uniqueness violations
 * - claims.latency: per-operation timings
 */
@Component
public class ClaimMetrics {

    private final MeterRegistry registry;

    private final Counter entriesVoided;
    private final DistributionSummary payoutAmount;

    public ClaimMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesVoided = Counter.builder("ledger.entries.voided")
                .description("Number of ledger entries voided")
                .register(registry);

        this.payoutAmount = DistributionSummary.builder("claims.payout.amount")
                .description("Amounts paid out for approved claims")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordEntryAppended(String kind) {
        registry.counter("ledger.entries.appended", "kind", sanitizeTag(kind)).increment();
    }

    public void recordEntryVoided() {
        entriesVoided.increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Claims ====================

    public void recordClaimFiled(String claimType, String status) {
        registry.counter("claims.filed",
                "claim_type", sanitizeTag(claimType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordClaimDecided(String outcome, String status) {
        registry.counter("claims.decided",
                "outcome", sanitizeTag(outcome),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordFailure(String code) {
        registry.counter("claims.failures", "code", sanitizeTag(code)).increment();
    }

    public void recordPayout(BigDecimal amount) {
        payoutAmount.record(amount.doubleValue());
    }

    public void recordIntegrityViolation(String code) {
        registry.counter("integrity.violations", "code", sanitizeTag(code)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("claims.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Billing events ====================

    public void recordBillingEvent(String eventType, boolean wasNew) {
        registry.counter("billing.events.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
