package com.flagship.classroom_ledger.enrollment;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EnrollmentNotFoundException extends RuntimeException {

    private final UUID enrollmentId;

    public EnrollmentNotFoundException(UUID enrollmentId) {
        super("Enrollment not found: " + enrollmentId);
        this.enrollmentId = enrollmentId;
    }
}
