package com.flagship.classroom_ledger.claim.event;

import com.flagship.classroom_ledger.claim.Claim;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class ClaimApprovedEvent implements ClaimEvent {
    UUID eventId;
    UUID claimId;
    UUID tenantId;
    UUID subjectId;
    UUID reviewerId;
    BigDecimal approvedAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimApproved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimApprovedEvent fromClaim(Claim claim) {
        return new ClaimApprovedEvent(
            UUID.randomUUID(),
            claim.getId(),
            claim.getTenantId(),
            claim.getSubjectId(),
            claim.getReviewerId(),
            claim.getApprovedAmount(),
            claim.getDecisionDate()
        );
    }
}
