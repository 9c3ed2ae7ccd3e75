package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.policy.ClaimType;
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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for insurance_claims.
 *
 * The claim variant is flattened into claim_type plus nullable
 * ledger_entry_id / requested_amount / claim_item columns; the database
 * checks that each row carries the columns of its type. One-claim-per-entry
 * is the partial unique index uq_claims_active_ledger_entry.
 */
@Entity
@Table(
    name = "insurance_claims",
    indexes = {
        @Index(name = "idx_claims_tenant_status", columnList = "tenant_id, status"),
        @Index(name = "idx_claims_subject_policy", columnList = "tenant_id, subject_id, policy_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClaimEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private UUID enrollmentId;

    @Column(name = "policy_id", nullable = false, updatable = false)
    private UUID policyId;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "claim_type", nullable = false, updatable = false, length = 30)
    private ClaimType claimType;

    @Column(name = "ledger_entry_id", updatable = false)
    private UUID ledgerEntryId;

    @Column(name = "requested_amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal requestedAmount;

    @Column(name = "claim_item", updatable = false)
    private String claimItem;

    @Column(name = "incident_date", nullable = false, updatable = false)
    private Instant incidentDate;

    @Column(name = "filed_date", nullable = false, updatable = false)
    private Instant filedDate;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String comments;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClaimStatus status;

    @Column(name = "approved_amount", precision = 19, scale = 4)
    private BigDecimal approvedAmount;

    @Column(name = "decision_date")
    private Instant decisionDate;

    @Column(name = "reviewer_id")
    private UUID reviewerId;

    @Column(name = "reviewer_notes", columnDefinition = "TEXT")
    private String reviewerNotes;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "payout_entry_id")
    private UUID payoutEntryId;

    @Column(name = "fulfilled_date")
    private Instant fulfilledDate;

    @Column(name = "fulfilled_by")
    private UUID fulfilledBy;

    static ClaimEntity fromDomain(Claim claim) {
        ClaimDetails details = claim.getDetails();
        UUID ledgerEntryId = null;
        BigDecimal requestedAmount = null;
        String claimItem = null;
        if (details instanceof TransactionClaimDetails transaction) {
            ledgerEntryId = transaction.getLedgerEntryId();
            requestedAmount = transaction.getRequestedAmount();
        } else if (details instanceof MonetaryClaimDetails monetary) {
            requestedAmount = monetary.getRequestedAmount();
        } else if (details instanceof InKindClaimDetails inKind) {
            claimItem = inKind.getClaimItem();
        }

        return new ClaimEntity(
            claim.getId(),
            claim.getTenantId(),
            claim.getEnrollmentId(),
            claim.getPolicyId(),
            claim.getSubjectId(),
            details.getClaimType(),
            ledgerEntryId,
            requestedAmount,
            claimItem,
            claim.getIncidentDate(),
            claim.getFiledDate(),
            claim.getDescription(),
            claim.getComments(),
            claim.getStatus(),
            claim.getApprovedAmount(),
            claim.getDecisionDate(),
            claim.getReviewerId(),
            claim.getReviewerNotes(),
            claim.getRejectionReason(),
            claim.getPayoutEntryId(),
            claim.getFulfilledDate(),
            claim.getFulfilledBy()
        );
    }

    public Claim toDomain() {
        ClaimDetails details = switch (claimType) {
            case TRANSACTION_MONETARY -> new TransactionClaimDetails(ledgerEntryId, requestedAmount);
            case LEGACY_MONETARY -> new MonetaryClaimDetails(requestedAmount);
            case NON_MONETARY -> new InKindClaimDetails(claimItem);
        };
        return new Claim(
            id,
            tenantId,
            enrollmentId,
            policyId,
            subjectId,
            details,
            incidentDate,
            filedDate,
            description,
            comments,
            status,
            approvedAmount,
            decisionDate,
            reviewerId,
            reviewerNotes,
            rejectionReason,
            payoutEntryId,
            fulfilledDate,
            fulfilledBy
        );
    }

    /**
     * Copies decision and payout fields. The claim's identity, variant and
     * filing data are never updated; a payout entry, once set, never changes.
     */
    void updateFromDomain(Claim claim) {
        if (this.status != claim.getStatus() && !this.status.canTransitionTo(claim.getStatus())) {
            throw new IllegalStateException(String.format(
                "Claim %s cannot move from %s to %s", id, this.status, claim.getStatus()));
        }
        if (this.payoutEntryId != null && !this.payoutEntryId.equals(claim.getPayoutEntryId())) {
            throw new IllegalStateException("Payout entry already recorded for claim " + id);
        }
        this.status = claim.getStatus();
        this.approvedAmount = claim.getApprovedAmount();
        this.decisionDate = claim.getDecisionDate();
        this.reviewerId = claim.getReviewerId();
        this.reviewerNotes = claim.getReviewerNotes();
        this.rejectionReason = claim.getRejectionReason();
        this.payoutEntryId = claim.getPayoutEntryId();
        this.fulfilledDate = claim.getFulfilledDate();
        this.fulfilledBy = claim.getFulfilledBy();
    }
}
