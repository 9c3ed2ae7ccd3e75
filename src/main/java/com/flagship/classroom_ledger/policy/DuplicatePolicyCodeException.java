package com.flagship.classroom_ledger.policy;

import lombok.Getter;

@Getter
public class DuplicatePolicyCodeException extends RuntimeException {

    private final String policyCode;

    public DuplicatePolicyCodeException(String policyCode) {
        super("Policy code already in use: " + policyCode);
        this.policyCode = policyCode;
    }
}
