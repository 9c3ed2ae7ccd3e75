package com.flagship.classroom_ledger.claim;

/**
 * Business-rule failures reported back to the subject or reviewer. They are
 * accumulated, never thrown.
 */
public enum ClaimFailureCode {
    COVERAGE_NOT_STARTED,
    CLAIM_WINDOW_EXPIRED,
    CLAIM_LIMIT_EXCEEDED,
    PAYOUT_CAP_EXCEEDED,
    PERIOD_PAYOUT_CAP_EXCEEDED,
    LINKED_TRANSACTION_VOIDED,
    OWNERSHIP_MISMATCH,
    PAYMENT_NOT_CURRENT,
    ENROLLMENT_NOT_ACTIVE,
    TRANSACTION_REQUIRED,
    INVALID_CLAIM_DETAILS,
    INVALID_AMOUNT,
    POLICY_MISCONFIGURED
}
