package com.flagship.classroom_ledger.claim;

import lombok.Getter;

import java.util.UUID;

/**
 * Decision attempted on a claim that was already decided.
 */
@Getter
public class ClaimNotPendingException extends RuntimeException {

    private final UUID claimId;
    private final ClaimStatus status;

    public ClaimNotPendingException(UUID claimId, ClaimStatus status) {
        super(String.format("Claim %s is %s, not PENDING", claimId, status));
        this.claimId = claimId;
        this.status = status;
    }
}
