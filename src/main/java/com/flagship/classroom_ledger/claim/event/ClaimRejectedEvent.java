package com.flagship.classroom_ledger.claim.event;

import com.flagship.classroom_ledger.claim.Claim;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ClaimRejectedEvent implements ClaimEvent {
    UUID eventId;
    UUID claimId;
    UUID tenantId;
    UUID subjectId;
    UUID reviewerId;
    String rejectionReason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimRejected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimRejectedEvent fromClaim(Claim claim) {
        return new ClaimRejectedEvent(
            UUID.randomUUID(),
            claim.getId(),
            claim.getTenantId(),
            claim.getSubjectId(),
            claim.getReviewerId(),
            claim.getRejectionReason(),
            claim.getDecisionDate()
        );
    }
}
