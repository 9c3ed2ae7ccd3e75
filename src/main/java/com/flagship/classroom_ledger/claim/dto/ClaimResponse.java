package com.flagship.classroom_ledger.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.claim.Claim;
import com.flagship.classroom_ledger.claim.ClaimDetails;
import com.flagship.classroom_ledger.claim.ClaimStatus;
import com.flagship.classroom_ledger.claim.InKindClaimDetails;
import com.flagship.classroom_ledger.claim.MonetaryClaimDetails;
import com.flagship.classroom_ledger.claim.TransactionClaimDetails;
import com.flagship.classroom_ledger.policy.ClaimType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ClaimResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("policy_id")
    UUID policyId;

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("claim_type")
    ClaimType claimType;

    @JsonProperty("ledger_entry_id")
    UUID ledgerEntryId;

    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @JsonProperty("claim_item")
    String claimItem;

    @JsonProperty("incident_date")
    Instant incidentDate;

    @JsonProperty("filed_date")
    Instant filedDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("comments")
    String comments;

    @JsonProperty("status")
    ClaimStatus status;

    @JsonProperty("approved_amount")
    BigDecimal approvedAmount;

    @JsonProperty("decision_date")
    Instant decisionDate;

    @JsonProperty("reviewer_id")
    UUID reviewerId;

    @JsonProperty("reviewer_notes")
    String reviewerNotes;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("payout_entry_id")
    UUID payoutEntryId;

    @JsonProperty("fulfilled_date")
    Instant fulfilledDate;

    @JsonProperty("fulfilled_by")
    UUID fulfilledBy;

    public static ClaimResponse from(Claim claim) {
        ClaimDetails details = claim.getDetails();
        BigDecimal requestedAmount = null;
        String claimItem = null;
        if (details instanceof TransactionClaimDetails transaction) {
            requestedAmount = transaction.getRequestedAmount();
        } else if (details instanceof MonetaryClaimDetails monetary) {
            requestedAmount = monetary.getRequestedAmount();
        } else if (details instanceof InKindClaimDetails inKind) {
            claimItem = inKind.getClaimItem();
        }

        return ClaimResponse.builder()
            .id(claim.getId())
            .enrollmentId(claim.getEnrollmentId())
            .policyId(claim.getPolicyId())
            .subjectId(claim.getSubjectId())
            .claimType(claim.getClaimType())
            .ledgerEntryId(claim.getLedgerEntryId())
            .requestedAmount(requestedAmount)
            .claimItem(claimItem)
            .incidentDate(claim.getIncidentDate())
            .filedDate(claim.getFiledDate())
            .description(claim.getDescription())
            .comments(claim.getComments())
            .status(claim.getStatus())
            .approvedAmount(claim.getApprovedAmount())
            .decisionDate(claim.getDecisionDate())
            .reviewerId(claim.getReviewerId())
            .reviewerNotes(claim.getReviewerNotes())
            .rejectionReason(claim.getRejectionReason())
            .payoutEntryId(claim.getPayoutEntryId())
            .fulfilledDate(claim.getFulfilledDate())
            .fulfilledBy(claim.getFulfilledBy())
            .build();
    }
}
