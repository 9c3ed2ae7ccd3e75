package com.flagship.classroom_ledger.claim;

import lombok.Value;

import java.util.List;

/**
 * Outcome of filing or deciding a claim.
 *
 * When {@code failures} is non-empty nothing was changed and {@code claim} is
 * the unchanged claim on decide, or null on file.
 */
@Value
public class ClaimResult {
    Claim claim;
    List<ClaimFailure> failures;

    public static ClaimResult success(Claim claim) {
        return new ClaimResult(claim, List.of());
    }

    public static ClaimResult failed(Claim claim, List<ClaimFailure> failures) {
        return new ClaimResult(claim, List.copyOf(failures));
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public boolean hasFailure(ClaimFailureCode code) {
        return failures.stream().anyMatch(failure -> failure.getCode() == code);
    }
}
