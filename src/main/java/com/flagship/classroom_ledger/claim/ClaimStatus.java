package com.flagship.classroom_ledger.claim;

import java.util.EnumSet;
import java.util.Set;

/**
 * Claim lifecycle. Nothing ever returns to PENDING; PAID and REJECTED are
 * terminal.
 */
public enum ClaimStatus {
    /**
     * Filed and waiting for a reviewer.
     */
    PENDING,

    /**
     * Reviewer approved. Monetary claims leave this state in the same
     * transaction by writing the payout; in-kind claims wait here until the
     * item is handed over.
     */
    APPROVED,

    /**
     * Reviewer rejected. Frees the linked ledger entry for a new claim.
     */
    REJECTED,

    /**
     * Payout written (monetary) or item fulfilled (in-kind).
     */
    PAID;

    public Set<ClaimStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(PAID);
            case REJECTED, PAID -> EnumSet.noneOf(ClaimStatus.class);
        };
    }

    public boolean canTransitionTo(ClaimStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    /**
     * Statuses that count against a policy's claim limit.
     */
    public static Set<ClaimStatus> countedTowardsLimit() {
        return EnumSet.of(APPROVED, PAID);
    }
}
