package com.flagship.classroom_ledger.enrollment;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * The policy forbids buying it again after a cancellation, either forever
 * ({@code blockedUntil == null}) or until the cooldown ends.
 */
@Getter
public class RepurchaseBlockedException extends RuntimeException {

    private final UUID policyId;
    private final Instant blockedUntil;

    public RepurchaseBlockedException(UUID policyId, Instant blockedUntil) {
        super(blockedUntil == null
                ? "Policy cannot be repurchased after cancellation: " + policyId
                : "Policy " + policyId + " cannot be repurchased before " + blockedUntil);
        this.policyId = policyId;
        this.blockedUntil = blockedUntil;
    }

    public boolean isPermanent() {
        return blockedUntil == null;
    }
}
