package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.policy.ClaimType;
import lombok.Value;

@Value
public class InKindClaimDetails implements ClaimDetails {
    String claimItem;

    @Override
    public ClaimType getClaimType() {
        return ClaimType.NON_MONETARY;
    }
}
