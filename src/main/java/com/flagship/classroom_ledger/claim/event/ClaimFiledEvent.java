package com.flagship.classroom_ledger.claim.event;

import com.flagship.classroom_ledger.claim.Claim;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ClaimFiledEvent implements ClaimEvent {
    UUID eventId;
    UUID claimId;
    UUID tenantId;
    UUID enrollmentId;
    UUID policyId;
    UUID subjectId;
    String claimType;
    UUID ledgerEntryId;
    Instant incidentDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ClaimFiled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ClaimFiledEvent fromClaim(Claim claim) {
        return new ClaimFiledEvent(
            UUID.randomUUID(),
            claim.getId(),
            claim.getTenantId(),
            claim.getEnrollmentId(),
            claim.getPolicyId(),
            claim.getSubjectId(),
            claim.getClaimType().name(),
            claim.getLedgerEntryId(),
            claim.getIncidentDate(),
            claim.getFiledDate()
        );
    }
}
