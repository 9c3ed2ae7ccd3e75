package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.policy.ClaimType;
import com.flagship.classroom_ledger.tenant.TenantOwned;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An insurance claim.
 *
 * Immutable: each transition returns a new Claim and is validated against
 * the {@link ClaimStatus} table. Claims are never deleted.
 */
@Value
public class Claim implements TenantOwned {
    UUID id;
    UUID tenantId;
    UUID enrollmentId;
    UUID policyId;
    UUID subjectId;
    ClaimDetails details;
    Instant incidentDate;
    Instant filedDate;
    String description;
    String comments;
    ClaimStatus status;
    BigDecimal approvedAmount;
    Instant decisionDate;
    UUID reviewerId;
    String reviewerNotes;
    String rejectionReason;
    UUID payoutEntryId;
    Instant fulfilledDate;
    UUID fulfilledBy;

    /**
     * New PENDING claim under the given enrollment. Tenant, policy and
     * subject are taken from the enrollment.
     */
    public static Claim file(UUID id, Enrollment enrollment, ClaimDetails details, Instant incidentDate,
                             String description, String comments, Instant now) {
        return new Claim(
            id,
            enrollment.getTenantId(),
            enrollment.getId(),
            enrollment.getPolicyId(),
            enrollment.getSubjectId(),
            details,
            incidentDate,
            now,
            description,
            comments,
            ClaimStatus.PENDING,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }

    /**
     * @param amount approved payout, null for in-kind claims
     */
    public Claim approve(UUID reviewerId, BigDecimal amount, String notes, Instant now) {
        requireTransition(ClaimStatus.APPROVED);
        return new Claim(id, tenantId, enrollmentId, policyId, subjectId, details, incidentDate, filedDate,
                description, comments, ClaimStatus.APPROVED, amount, now, reviewerId, notes, null, null, null, null);
    }

    public Claim reject(UUID reviewerId, String reason, String notes, Instant now) {
        requireTransition(ClaimStatus.REJECTED);
        return new Claim(id, tenantId, enrollmentId, policyId, subjectId, details, incidentDate, filedDate,
                description, comments, ClaimStatus.REJECTED, null, now, reviewerId, notes, reason, null, null, null);
    }

    /**
     * Monetary claim paid by the given ledger entry.
     */
    public Claim markPaid(UUID payoutEntryId) {
        if (!isMonetary()) {
            throw new IllegalStateException("In-kind claim " + id + " is fulfilled, not paid out");
        }
        if (payoutEntryId == null) {
            throw new IllegalArgumentException("Payout entry is required");
        }
        requireTransition(ClaimStatus.PAID);
        return new Claim(id, tenantId, enrollmentId, policyId, subjectId, details, incidentDate, filedDate,
                description, comments, ClaimStatus.PAID, approvedAmount, decisionDate, reviewerId, reviewerNotes,
                rejectionReason, payoutEntryId, null, null);
    }

    /**
     * In-kind claim handed over by {@code fulfilledBy}. No ledger entry is written.
     */
    public Claim fulfill(UUID fulfilledBy, Instant now) {
        if (isMonetary()) {
            throw new IllegalStateException("Monetary claim " + id + " is paid through the ledger");
        }
        if (fulfilledBy == null) {
            throw new IllegalArgumentException("Fulfilling reviewer is required");
        }
        requireTransition(ClaimStatus.PAID);
        return new Claim(id, tenantId, enrollmentId, policyId, subjectId, details, incidentDate, filedDate,
                description, comments, ClaimStatus.PAID, approvedAmount, decisionDate, reviewerId, reviewerNotes,
                rejectionReason, null, now, fulfilledBy);
    }

    public ClaimType getClaimType() {
        return details.getClaimType();
    }

    public boolean isMonetary() {
        return getClaimType().isMonetary();
    }

    /**
     * @return the linked ledger entry, or null for claims without one
     */
    public UUID getLedgerEntryId() {
        return details instanceof TransactionClaimDetails transaction ? transaction.getLedgerEntryId() : null;
    }

    /**
     * Approved and monetary but the payout was never written. Only an
     * interrupted writer outside the decision transaction can leave this.
     */
    public boolean isAwaitingPayout() {
        return status == ClaimStatus.APPROVED && isMonetary() && payoutEntryId == null;
    }

    private void requireTransition(ClaimStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Cannot move claim %s from %s to %s", id, status, target));
        }
    }
}
