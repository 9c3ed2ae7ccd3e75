package com.flagship.classroom_ledger.enrollment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of enrollment events published through the outbox.
 */
public interface EnrollmentEvent {

    UUID getEventId();

    UUID getEnrollmentId();

    UUID getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
