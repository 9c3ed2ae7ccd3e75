package com.flagship.classroom_ledger.claim.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.claim.ClaimOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ClaimDecisionRequest {

    @NotNull(message = "Reviewer ID is required")
    @JsonProperty("reviewer_id")
    UUID reviewerId;

    @NotNull(message = "Outcome is required")
    @JsonProperty("outcome")
    ClaimOutcome outcome;

    /** Optional; defaults to the claimed amount. */
    @JsonProperty("approved_amount")
    BigDecimal approvedAmount;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;

    @Size(max = 255, message = "Rejection reason must be at most 255 characters")
    @JsonProperty("rejection_reason")
    String rejectionReason;
}
