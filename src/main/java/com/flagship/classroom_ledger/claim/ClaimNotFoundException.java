package com.flagship.classroom_ledger.claim;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ClaimNotFoundException extends RuntimeException {

    private final UUID claimId;

    public ClaimNotFoundException(UUID claimId) {
        super("Claim not found: " + claimId);
        this.claimId = claimId;
    }
}
