package com.flagship.classroom_ledger.enrollment.event;

import com.flagship.classroom_ledger.enrollment.Enrollment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EnrollmentCancelledEvent implements EnrollmentEvent {
    UUID eventId;
    UUID enrollmentId;
    UUID tenantId;
    UUID subjectId;
    UUID policyId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EnrollmentCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EnrollmentCancelledEvent fromEnrollment(Enrollment enrollment) {
        return new EnrollmentCancelledEvent(
            UUID.randomUUID(),
            enrollment.getId(),
            enrollment.getTenantId(),
            enrollment.getSubjectId(),
            enrollment.getPolicyId(),
            enrollment.getCancelDate()
        );
    }
}
