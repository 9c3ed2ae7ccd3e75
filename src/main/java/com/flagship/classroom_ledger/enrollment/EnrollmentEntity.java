package com.flagship.classroom_ledger.enrollment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for insurance_enrollments.
 *
 * The partial unique index uq_enrollments_active (tenant, subject, policy
 * where status is ACTIVE or SUSPENDED) lives in the Flyway migration.
 */
@Entity
@Table(
    name = "insurance_enrollments",
    indexes = {
        @Index(name = "idx_enrollments_subject", columnList = "tenant_id, subject_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnrollmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(name = "policy_id", nullable = false, updatable = false)
    private UUID policyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EnrollmentStatus status;

    @Column(name = "purchase_date", nullable = false, updatable = false)
    private Instant purchaseDate;

    @Column(name = "cancel_date")
    private Instant cancelDate;

    @Column(name = "last_payment_date")
    private Instant lastPaymentDate;

    @Column(name = "next_payment_due")
    private Instant nextPaymentDue;

    @Column(name = "coverage_start_date", nullable = false, updatable = false)
    private Instant coverageStartDate;

    @Column(name = "payment_current", nullable = false)
    private boolean paymentCurrent;

    @Column(name = "days_unpaid", nullable = false)
    private int daysUnpaid;

    @Column(name = "premium_entry_id", updatable = false)
    private UUID premiumEntryId;

    static EnrollmentEntity fromDomain(Enrollment enrollment) {
        return new EnrollmentEntity(
            enrollment.getId(),
            enrollment.getTenantId(),
            enrollment.getSubjectId(),
            enrollment.getPolicyId(),
            enrollment.getStatus(),
            enrollment.getPurchaseDate(),
            enrollment.getCancelDate(),
            enrollment.getLastPaymentDate(),
            enrollment.getNextPaymentDue(),
            enrollment.getCoverageStartDate(),
            enrollment.isPaymentCurrent(),
            enrollment.getDaysUnpaid(),
            enrollment.getPremiumEntryId()
        );
    }

    public Enrollment toDomain() {
        return new Enrollment(
            id,
            tenantId,
            subjectId,
            policyId,
            status,
            purchaseDate,
            cancelDate,
            lastPaymentDate,
            nextPaymentDue,
            coverageStartDate,
            paymentCurrent,
            daysUnpaid,
            premiumEntryId
        );
    }

    /**
     * Copies the fields the billing producer and cancellation may change.
     * The transition itself was validated by the domain object.
     */
    void updateFromDomain(Enrollment enrollment) {
        if (!this.status.equals(enrollment.getStatus()) && !this.status.canTransitionTo(enrollment.getStatus())) {
            throw new IllegalStateException(String.format(
                "Enrollment %s cannot move from %s to %s", id, this.status, enrollment.getStatus()));
        }
        this.status = enrollment.getStatus();
        this.cancelDate = enrollment.getCancelDate();
        this.lastPaymentDate = enrollment.getLastPaymentDate();
        this.nextPaymentDue = enrollment.getNextPaymentDue();
        this.paymentCurrent = enrollment.isPaymentCurrent();
        this.daysUnpaid = enrollment.getDaysUnpaid();
    }
}
