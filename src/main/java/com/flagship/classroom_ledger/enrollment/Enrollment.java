package com.flagship.classroom_ledger.enrollment;

import com.flagship.classroom_ledger.policy.Policy;
import com.flagship.classroom_ledger.tenant.TenantOwned;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A subject's relationship to one policy.
 *
 * Immutable value: every mutation returns a new instance and is checked
 * against the {@link EnrollmentStatus} transition table.
 */
@Value
public class Enrollment implements TenantOwned {
    UUID id;
    UUID tenantId;
    UUID subjectId;
    UUID policyId;
    EnrollmentStatus status;
    Instant purchaseDate;
    Instant cancelDate;
    Instant lastPaymentDate;
    Instant nextPaymentDue;
    Instant coverageStartDate;
    boolean paymentCurrent;
    int daysUnpaid;
    UUID premiumEntryId;

    /**
     * New ACTIVE enrollment whose first premium was just charged by
     * {@code premiumEntryId}. Coverage starts after the waiting period.
     */
    public static Enrollment create(UUID id, UUID subjectId, Policy policy, UUID premiumEntryId, Instant now) {
        return new Enrollment(
            id,
            policy.getTenantId(),
            subjectId,
            policy.getId(),
            EnrollmentStatus.ACTIVE,
            now,
            null,
            now,
            now.plus(policy.getChargeFrequency().interval()),
            now.plus(Duration.ofDays(policy.getWaitingPeriodDays())),
            true,
            0,
            premiumEntryId
        );
    }

    /**
     * Premium received. Resets the unpaid counter and reactivates a
     * suspended enrollment.
     *
     * @throws EnrollmentCancelledException if cancelled
     */
    public Enrollment recordPayment(Instant now, Duration chargeInterval) {
        requireNotCancelled();
        EnrollmentStatus next = status == EnrollmentStatus.SUSPENDED ? EnrollmentStatus.ACTIVE : status;
        return new Enrollment(id, tenantId, subjectId, policyId, next, purchaseDate, cancelDate,
                now, now.plus(chargeInterval), coverageStartDate, true, 0, premiumEntryId);
    }

    /**
     * One more unpaid day. Once the counter reaches
     * {@code autoSuspendNonpayDays} (when positive) an active enrollment is
     * suspended.
     *
     * @throws EnrollmentCancelledException if cancelled
     */
    public Enrollment markUnpaid(int autoSuspendNonpayDays) {
        requireNotCancelled();
        int unpaid = daysUnpaid + 1;
        EnrollmentStatus next = status;
        if (status == EnrollmentStatus.ACTIVE && autoSuspendNonpayDays > 0 && unpaid >= autoSuspendNonpayDays) {
            next = EnrollmentStatus.SUSPENDED;
        }
        return new Enrollment(id, tenantId, subjectId, policyId, next, purchaseDate, cancelDate,
                lastPaymentDate, nextPaymentDue, coverageStartDate, false, unpaid, premiumEntryId);
    }

    /**
     * @throws EnrollmentCancelledException if already cancelled
     */
    public Enrollment cancel(Instant now) {
        requireNotCancelled();
        return new Enrollment(id, tenantId, subjectId, policyId, EnrollmentStatus.CANCELLED, purchaseDate, now,
                lastPaymentDate, nextPaymentDue, coverageStartDate, paymentCurrent, daysUnpaid, premiumEntryId);
    }

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE;
    }

    public boolean isCoverageStarted(Instant now) {
        return !now.isBefore(coverageStartDate);
    }

    private void requireNotCancelled() {
        if (status.isTerminal()) {
            throw new EnrollmentCancelledException(id);
        }
    }
}
