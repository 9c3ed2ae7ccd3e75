package com.flagship.classroom_ledger.claim;

public enum ClaimOutcome {
    APPROVE,
    REJECT
}
