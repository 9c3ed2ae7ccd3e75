package com.flagship.classroom_ledger.policy;

import lombok.Getter;

import java.util.UUID;

/**
 * Terms of a policy cannot change once a claim references it; only
 * deactivation is still allowed.
 */
@Getter
public class PolicyLockedException extends RuntimeException {

    private final UUID policyId;

    public PolicyLockedException(UUID policyId) {
        super("Policy terms are locked because claims exist: " + policyId);
        this.policyId = policyId;
    }
}
