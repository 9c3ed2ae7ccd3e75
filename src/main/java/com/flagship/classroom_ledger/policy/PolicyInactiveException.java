package com.flagship.classroom_ledger.policy;

import lombok.Getter;

import java.util.UUID;

/**
 * A deactivated policy can no longer be purchased.
 */
@Getter
public class PolicyInactiveException extends RuntimeException {

    private final UUID policyId;

    public PolicyInactiveException(UUID policyId) {
        super("Policy is not active: " + policyId);
        this.policyId = policyId;
    }
}
