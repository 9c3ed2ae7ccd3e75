package com.flagship.classroom_ledger.enrollment;

import lombok.Getter;

import java.util.UUID;

/**
 * Mutation attempted on a cancelled enrollment. Cancellation is terminal.
 */
@Getter
public class EnrollmentCancelledException extends RuntimeException {

    private final UUID enrollmentId;

    public EnrollmentCancelledException(UUID enrollmentId) {
        super("Enrollment is cancelled: " + enrollmentId);
        this.enrollmentId = enrollmentId;
    }
}
