package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.policy.ClaimType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Monetary claim not tied to a ledger entry; the requested amount is the
 * payout base.
 */
@Value
public class MonetaryClaimDetails implements ClaimDetails {
    BigDecimal requestedAmount;

    @Override
    public ClaimType getClaimType() {
        return ClaimType.LEGACY_MONETARY;
    }
}
