package com.flagship.classroom_ledger.policy;

import lombok.Getter;

import java.util.UUID;

@Getter
public class PolicyNotFoundException extends RuntimeException {

    private final UUID policyId;

    public PolicyNotFoundException(UUID policyId) {
        super("Policy not found: " + policyId);
        this.policyId = policyId;
    }
}
