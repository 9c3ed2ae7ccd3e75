package com.flagship.classroom_ledger.claim.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of claim lifecycle events published through the outbox.
 */
public interface ClaimEvent {

    UUID getEventId();

    UUID getClaimId();

    UUID getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
