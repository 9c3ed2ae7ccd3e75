package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import com.flagship.classroom_ledger.policy.ClaimType;
import com.flagship.classroom_ledger.policy.Policy;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Business rules for filing and approving claims.
 *
 * Pure: every input, including "now" and the rolling-window aggregates, is
 * passed in. All applicable failures are collected; nothing short-circuits.
 */
@Component
public class ClaimValidator {

    /**
     * Everything the rules look at. {@code linkedEntry} is null for claims
     * without a ledger entry, {@code approvedAmount} is only used on decide.
     */
    @Value
    @Builder
    public static class ClaimCheck {
        Policy policy;
        Enrollment enrollment;
        LedgerEntry linkedEntry;
        UUID subjectId;
        ClaimDetails details;
        Instant incidentDate;
        Instant filedDate;
        Instant now;
        long claimsInWindow;
        BigDecimal approvedInWindow;
        BigDecimal approvedAmount;
    }

    public List<ClaimFailure> validateFiling(ClaimCheck check) {
        List<ClaimFailure> failures = new ArrayList<>();
        Policy policy = check.getPolicy();
        Enrollment enrollment = check.getEnrollment();

        checkPolicyTerms(policy, failures);
        checkDetails(policy, check.getDetails(), failures);

        if (!enrollment.getSubjectId().equals(check.getSubjectId())) {
            failures.add(ClaimFailure.of(ClaimFailureCode.OWNERSHIP_MISMATCH,
                    "Enrollment belongs to a different subject"));
        }
        checkEnrollmentStanding(enrollment, check.getNow(), failures);

        checkClaimWindow(policy, check.getIncidentDate(), check.getNow(), failures);
        checkClaimLimit(policy, check.getClaimsInWindow(), failures);
        checkLinkedEntry(check.getLinkedEntry(), check.getSubjectId(), failures);

        BigDecimal requested = requestedAmount(check.getDetails());
        if (requested != null) {
            if (requested.signum() <= 0) {
                failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_AMOUNT,
                        "Requested amount must be positive"));
            } else {
                checkPayoutCaps(policy, requested, baseAmount(check.getDetails(), check.getLinkedEntry()), failures);
            }
        }

        return failures;
    }

    /**
     * Re-validation at approval time, on freshly locked rows. State may have
     * changed since filing: the entry may be void, the enrollment cancelled
     * or unpaid, other claims approved.
     */
    public List<ClaimFailure> validateApproval(ClaimCheck check) {
        List<ClaimFailure> failures = new ArrayList<>();
        Policy policy = check.getPolicy();
        Enrollment enrollment = check.getEnrollment();

        checkPolicyTerms(policy, failures);

        if (check.getDetails().getClaimType().requiresLedgerEntry()) {
            checkLinkedEntry(check.getLinkedEntry(), check.getSubjectId(), failures);
        }
        checkEnrollmentStanding(enrollment, check.getNow(), failures);

        checkClaimWindow(policy, check.getIncidentDate(), check.getFiledDate(), failures);
        checkClaimLimit(policy, check.getClaimsInWindow(), failures);

        if (check.getDetails().getClaimType().isMonetary()) {
            BigDecimal amount = check.getApprovedAmount();
            if (amount == null || amount.signum() <= 0) {
                failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_AMOUNT,
                        "Approved amount must be positive"));
            } else {
                checkPayoutCaps(policy, amount, baseAmount(check.getDetails(), check.getLinkedEntry()), failures);
                BigDecimal periodCap = policy.getMaxPayoutPerPeriod();
                BigDecimal alreadyApproved = check.getApprovedInWindow() != null
                        ? check.getApprovedInWindow() : BigDecimal.ZERO;
                if (periodCap != null && alreadyApproved.add(amount).compareTo(periodCap) > 0) {
                    failures.add(ClaimFailure.of(ClaimFailureCode.PERIOD_PAYOUT_CAP_EXCEEDED, String.format(
                            "Payouts this %s would reach %s, limit is %s",
                            policy.getMaxClaimsPeriod().name().toLowerCase(), alreadyApproved.add(amount), periodCap)));
                }
            }
        }

        return failures;
    }

    /**
     * Upper bound of a payout: the absolute amount of the linked entry for
     * transaction claims, the requested amount for legacy claims, null for
     * in-kind claims.
     */
    public BigDecimal baseAmount(ClaimDetails details, LedgerEntry linkedEntry) {
        if (details instanceof TransactionClaimDetails) {
            return linkedEntry != null ? linkedEntry.getAmount().abs() : null;
        }
        if (details instanceof MonetaryClaimDetails monetary) {
            return monetary.getRequestedAmount();
        }
        return null;
    }

    /**
     * Whole days between two instants, truncated.
     */
    static long daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toDays();
    }

    private void checkPolicyTerms(Policy policy, List<ClaimFailure> failures) {
        for (String problem : policy.termProblems()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.POLICY_MISCONFIGURED, "Policy " + problem));
        }
    }

    private void checkDetails(Policy policy, ClaimDetails details, List<ClaimFailure> failures) {
        ClaimType expected = policy.getClaimType();
        if (details == null) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS, "Claim details are required"));
            return;
        }
        if (expected == ClaimType.TRANSACTION_MONETARY) {
            if (!(details instanceof TransactionClaimDetails transaction) || transaction.getLedgerEntryId() == null) {
                failures.add(ClaimFailure.of(ClaimFailureCode.TRANSACTION_REQUIRED,
                        "Policy pays out against a specific ledger entry"));
            }
            return;
        }
        if (expected != null && expected != details.getClaimType()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS, String.format(
                    "Policy expects %s claims, got %s", expected, details.getClaimType())));
            return;
        }
        if (details instanceof MonetaryClaimDetails monetary && monetary.getRequestedAmount() == null) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS,
                    "Claim amount is required for monetary policies"));
        }
        if (details instanceof InKindClaimDetails inKind
                && (inKind.getClaimItem() == null || inKind.getClaimItem().isBlank())) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS,
                    "Claim item is required for non-monetary policies"));
        }
    }

    private void checkEnrollmentStanding(Enrollment enrollment, Instant now, List<ClaimFailure> failures) {
        if (!enrollment.isActive()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.ENROLLMENT_NOT_ACTIVE,
                    "Enrollment is " + enrollment.getStatus()));
        }
        if (!enrollment.isPaymentCurrent()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.PAYMENT_NOT_CURRENT,
                    "Premium payments are not current"));
        }
        if (!enrollment.isCoverageStarted(now)) {
            failures.add(ClaimFailure.of(ClaimFailureCode.COVERAGE_NOT_STARTED,
                    "Coverage starts " + enrollment.getCoverageStartDate()));
        }
    }

    private void checkClaimWindow(Policy policy, Instant incidentDate, Instant reference, List<ClaimFailure> failures) {
        if (incidentDate == null) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS, "Incident date is required"));
            return;
        }
        if (incidentDate.isAfter(reference)) {
            failures.add(ClaimFailure.of(ClaimFailureCode.INVALID_CLAIM_DETAILS, "Incident date is in the future"));
            return;
        }
        long days = daysBetween(incidentDate, reference);
        if (days > policy.getClaimTimeLimitDays()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.CLAIM_WINDOW_EXPIRED, String.format(
                    "Claim filed %d days after incident, limit is %d days", days, policy.getClaimTimeLimitDays())));
        }
    }

    private void checkClaimLimit(Policy policy, long claimsInWindow, List<ClaimFailure> failures) {
        Integer max = policy.getMaxClaimsCount();
        if (max != null && claimsInWindow >= max) {
            failures.add(ClaimFailure.of(ClaimFailureCode.CLAIM_LIMIT_EXCEEDED, String.format(
                    "Maximum claims reached (%d per %s)", max, policy.getMaxClaimsPeriod().name().toLowerCase())));
        }
    }

    private void checkLinkedEntry(LedgerEntry entry, UUID subjectId, List<ClaimFailure> failures) {
        if (entry == null) {
            return;
        }
        if (entry.isVoided()) {
            failures.add(ClaimFailure.of(ClaimFailureCode.LINKED_TRANSACTION_VOIDED,
                    "Linked ledger entry " + entry.getId() + " has been voided"));
        }
        if (!entry.getSubjectId().equals(subjectId)) {
            failures.add(ClaimFailure.of(ClaimFailureCode.OWNERSHIP_MISMATCH,
                    "Linked ledger entry belongs to a different subject"));
        }
    }

    private void checkPayoutCaps(Policy policy, BigDecimal amount, BigDecimal base, List<ClaimFailure> failures) {
        BigDecimal maxClaim = policy.getMaxClaimAmount();
        if (maxClaim != null && amount.compareTo(maxClaim) > 0) {
            failures.add(ClaimFailure.of(ClaimFailureCode.PAYOUT_CAP_EXCEEDED, String.format(
                    "Amount %s exceeds the policy maximum of %s", amount, maxClaim)));
        }
        if (base != null && amount.compareTo(base) > 0) {
            failures.add(ClaimFailure.of(ClaimFailureCode.PAYOUT_CAP_EXCEEDED, String.format(
                    "Amount %s exceeds the claimed amount of %s", amount, base)));
        }
    }

    private static BigDecimal requestedAmount(ClaimDetails details) {
        if (details instanceof TransactionClaimDetails transaction) {
            return transaction.getRequestedAmount();
        }
        if (details instanceof MonetaryClaimDetails monetary) {
            return monetary.getRequestedAmount();
        }
        return null;
    }
}
