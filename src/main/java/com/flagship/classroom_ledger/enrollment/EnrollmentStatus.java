package com.flagship.classroom_ledger.enrollment;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a subject's enrollment in a policy. Enrollments are never
 * deleted; CANCELLED is terminal.
 */
public enum EnrollmentStatus {
    ACTIVE,
    SUSPENDED,
    CANCELLED;

    public Set<EnrollmentStatus> allowedTransitions() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(SUSPENDED, CANCELLED);
            case SUSPENDED -> EnumSet.of(ACTIVE, CANCELLED);
            case CANCELLED -> EnumSet.noneOf(EnrollmentStatus.class);
        };
    }

    public boolean canTransitionTo(EnrollmentStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }

    /**
     * ACTIVE and SUSPENDED both block a second purchase of the same policy.
     */
    public boolean holdsPolicy() {
        return this != CANCELLED;
    }
}
