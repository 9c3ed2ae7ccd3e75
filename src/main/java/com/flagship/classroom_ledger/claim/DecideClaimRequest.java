package com.flagship.classroom_ledger.claim;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A reviewer's decision. {@code approvedAmount} defaults to the claim's base
 * amount when omitted and is ignored for in-kind claims and rejections.
 */
@Value
@Builder
public class DecideClaimRequest {
    UUID claimId;
    UUID reviewerId;
    ClaimOutcome outcome;
    BigDecimal approvedAmount;
    String notes;
    String rejectionReason;
}
