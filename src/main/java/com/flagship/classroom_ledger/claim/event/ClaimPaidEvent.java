package com.flagship.classroom_ledger.claim.event;

import com.flagship.classroom_ledger.claim.Claim;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Claim settled. In-kind claims carry {@code fulfilledBy} and no
 * {@code payoutEntryId}; monetary claims the reverse.
 */
@Value
public class ClaimPaidEvent implements ClaimEvent {
    UUID eventId;
    UUID claimId;
    UUID tenantId;
    UUID subjectId;
    BigDecimal amount;
    UUID payoutEntryId;
    UUID fulfilledBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimPaid";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimPaidEvent fromClaim(Claim claim, Instant occurredAt) {
        return new ClaimPaidEvent(
            UUID.randomUUID(),
            claim.getId(),
            claim.getTenantId(),
            claim.getSubjectId(),
            claim.getApprovedAmount(),
            claim.getPayoutEntryId(),
            claim.getFulfilledBy(),
            occurredAt
        );
    }
}
