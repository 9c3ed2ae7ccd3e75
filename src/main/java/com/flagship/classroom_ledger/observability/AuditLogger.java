package com.flagship.classroom_ledger.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Writes audit records to the dedicated {@code AUDIT} logger.
 *
 * The logger name is routed to its own appender in logback-spring.xml so
 * integrity violations, voids and payouts can be retained separately from
 * application logs.
 */
@Component
public class AuditLogger {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    public void integrityViolation(String code, UUID tenantId, String entityType, UUID entityId, String detail) {
        AUDIT.warn("integrity_violation code={} tenantId={} entityType={} entityId={} correlationId={} detail={}",
                code, tenantId, entityType, entityId, CorrelationContext.getCorrelationId(), detail);
    }

    public void entryVoided(UUID tenantId, UUID entryId, UUID actorId) {
        AUDIT.info("ledger_entry_voided tenantId={} entryId={} actorId={} correlationId={}",
                tenantId, entryId, actorId, CorrelationContext.getCorrelationId());
    }

    public void voidRejected(UUID tenantId, UUID entryId, UUID actorId) {
        AUDIT.warn("ledger_entry_void_rejected reason=already_voided tenantId={} entryId={} actorId={} correlationId={}",
                tenantId, entryId, actorId, CorrelationContext.getCorrelationId());
    }

    public void claimDecided(UUID tenantId, UUID claimId, UUID reviewerId, String outcome) {
        AUDIT.info("claim_decided tenantId={} claimId={} reviewerId={} outcome={} correlationId={}",
                tenantId, claimId, reviewerId, outcome, CorrelationContext.getCorrelationId());
    }

    public void claimFulfilled(UUID tenantId, UUID claimId, UUID fulfilledBy) {
        AUDIT.info("claim_fulfilled tenantId={} claimId={} fulfilledBy={} correlationId={}",
                tenantId, claimId, fulfilledBy, CorrelationContext.getCorrelationId());
    }

    public void payoutWritten(UUID tenantId, UUID claimId, UUID payoutEntryId, BigDecimal amount) {
        AUDIT.info("claim_payout_written tenantId={} claimId={} payoutEntryId={} amount={} correlationId={}",
                tenantId, claimId, payoutEntryId, amount, CorrelationContext.getCorrelationId());
    }
}
