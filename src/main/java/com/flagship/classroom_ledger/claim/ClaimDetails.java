package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.policy.ClaimType;

/**
 * Variant part of a claim, discriminated by {@link #getClaimType()}.
 *
 * Each variant only carries the fields that make sense for it:
 * {@link TransactionClaimDetails}, {@link MonetaryClaimDetails} and
 * {@link InKindClaimDetails}.
 */
public interface ClaimDetails {

    ClaimType getClaimType();
}
