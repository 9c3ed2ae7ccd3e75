package com.flagship.classroom_ledger.enrollment.event;

import com.flagship.classroom_ledger.enrollment.Enrollment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class EnrollmentCreatedEvent implements EnrollmentEvent {
    UUID eventId;
    UUID enrollmentId;
    UUID tenantId;
    UUID subjectId;
    UUID policyId;
    BigDecimal premiumCharged;
    UUID premiumEntryId;
    Instant coverageStartDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EnrollmentCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EnrollmentCreatedEvent fromEnrollment(Enrollment enrollment, BigDecimal premiumCharged) {
        return new EnrollmentCreatedEvent(
            UUID.randomUUID(),
            enrollment.getId(),
            enrollment.getTenantId(),
            enrollment.getSubjectId(),
            enrollment.getPolicyId(),
            premiumCharged,
            enrollment.getPremiumEntryId(),
            enrollment.getCoverageStartDate(),
            enrollment.getPurchaseDate()
        );
    }
}
