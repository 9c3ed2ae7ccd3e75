package com.flagship.classroom_ledger.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.claim.ClaimDetails;
import com.flagship.classroom_ledger.claim.InKindClaimDetails;
import com.flagship.classroom_ledger.claim.MonetaryClaimDetails;
import com.flagship.classroom_ledger.claim.TransactionClaimDetails;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Request body for filing a claim. Which details variant is built depends on
 * the fields present: {@code ledger_entry_id} for transaction claims,
 * {@code claim_item} for in-kind claims, otherwise a plain amount.
 */
@Value
public class CreateClaimRequest {

    @NotNull(message = "Subject ID is required")
    @JsonProperty("subject_id")
    UUID subjectId;

    @NotNull(message = "Enrollment ID is required")
    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("ledger_entry_id")
    UUID ledgerEntryId;

    @JsonProperty("requested_amount")
    BigDecimal requestedAmount;

    @Size(max = 255, message = "Claim item must be at most 255 characters")
    @JsonProperty("claim_item")
    String claimItem;

    @NotNull(message = "Incident date is required")
    @JsonProperty("incident_date")
    Instant incidentDate;

    @Size(max = 1000, message = "Description must be at most 1000 characters")
    @JsonProperty("description")
    String description;

    @Size(max = 1000, message = "Comments must be at most 1000 characters")
    @JsonProperty("comments")
    String comments;

    public ClaimDetails toDetails() {
        if (ledgerEntryId != null) {
            return new TransactionClaimDetails(ledgerEntryId, requestedAmount);
        }
        if (claimItem != null) {
            return new InKindClaimDetails(claimItem);
        }
        return new MonetaryClaimDetails(requestedAmount);
    }
}
