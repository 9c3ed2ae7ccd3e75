package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.policy.ClaimType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Monetary claim against exactly one ledger entry. The requested amount is
 * optional; the payout base is the entry's absolute amount.
 */
@Value
public class TransactionClaimDetails implements ClaimDetails {
    UUID ledgerEntryId;
    BigDecimal requestedAmount;

    @Override
    public ClaimType getClaimType() {
        return ClaimType.TRANSACTION_MONETARY;
    }
}
