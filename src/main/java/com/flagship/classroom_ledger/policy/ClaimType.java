package com.flagship.classroom_ledger.policy;

/**
 * What a claim under a policy pays out, and what it must reference.
 */
public enum ClaimType {
    /**
     * Monetary, tied to exactly one ledger entry; the entry's absolute amount
     * is the base for the payout.
     */
    TRANSACTION_MONETARY,

    /**
     * Monetary without a linked entry; the requested amount is the base.
     */
    LEGACY_MONETARY,

    /**
     * In-kind: approval is fulfilled outside the ledger.
     */
    NON_MONETARY;

    public boolean isMonetary() {
        return this != NON_MONETARY;
    }

    public boolean requiresLedgerEntry() {
        return this == TRANSACTION_MONETARY;
    }
}
