package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.claim.ClaimValidator.ClaimCheck;
import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.EntryKind;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import com.flagship.classroom_ledger.policy.ChargeFrequency;
import com.flagship.classroom_ledger.policy.ClaimPeriod;
import com.flagship.classroom_ledger.policy.ClaimType;
import com.flagship.classroom_ledger.policy.Policy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ClaimValidatorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    private final ClaimValidator validator = new ClaimValidator();

    private UUID tenantId;
    private UUID subjectId;
    private Policy policy;
    private Enrollment enrollment;
    private LedgerEntry purchase;

    @BeforeEach
    void setUp() {
        tenantId = UUID.randomUUID();
        subjectId = UUID.randomUUID();
        policy = policy(ClaimType.TRANSACTION_MONETARY).build();
        enrollment = Enrollment.create(UUID.randomUUID(), subjectId, policy, UUID.randomUUID(),
                NOW.minus(Duration.ofDays(17)));
        purchase = entry(subjectId, "-50.00", false);
    }

    private Policy.PolicyBuilder policy(ClaimType claimType) {
        return Policy.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .policyCode("P")
            .title("Test")
            .premium(new BigDecimal("10"))
            .chargeFrequency(ChargeFrequency.MONTHLY)
            .waitingPeriodDays(7)
            .maxClaimsPeriod(ClaimPeriod.MONTH)
            .claimType(claimType)
            .claimTimeLimitDays(30)
            .bundleWithPolicyIds(Set.of())
            .active(true);
    }

    private LedgerEntry entry(UUID owner, String amount, boolean voided) {
        return new LedgerEntry(UUID.randomUUID(), tenantId, owner, new BigDecimal(amount), AccountBucket.CHECKING,
                EntryKind.PURCHASE, "Lunch", NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(2)),
                voided, voided ? NOW : null, null, null, 1L);
    }

    private ClaimCheck.ClaimCheckBuilder filing(ClaimDetails details) {
        return ClaimCheck.builder()
            .policy(policy)
            .enrollment(enrollment)
            .linkedEntry(purchase)
            .subjectId(subjectId)
            .details(details)
            .incidentDate(NOW.minus(Duration.ofDays(1)))
            .filedDate(NOW)
            .now(NOW);
    }

    private static List<ClaimFailureCode> codes(List<ClaimFailure> failures) {
        return failures.stream().map(ClaimFailure::getCode).toList();
    }

    @Test
    @DisplayName("Eligible transaction claim passes")
    void testEligibleClaim() {
        List<ClaimFailure> failures = validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), null)).build());

        assertTrue(failures.isEmpty(), "Unexpected failures: " + failures);
    }

    @Test
    @DisplayName("Coverage starts exactly at the end of the waiting period")
    void testCoverageBoundary() {
        Enrollment fresh = Enrollment.create(UUID.randomUUID(), subjectId, policy, null, NOW.minus(Duration.ofDays(7)));
        assertTrue(validator.validateFiling(filing(new TransactionClaimDetails(purchase.getId(), null))
                .enrollment(fresh).build()).isEmpty());

        Enrollment tooFresh = Enrollment.create(UUID.randomUUID(), subjectId, policy, null,
                NOW.minus(Duration.ofDays(7)).plusSeconds(1));
        assertEquals(List.of(ClaimFailureCode.COVERAGE_NOT_STARTED), codes(validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), null)).enrollment(tooFresh).build())));
    }

    @Test
    @DisplayName("30 days after the incident is still inside a 30 day window, 31 is not")
    void testClaimWindowBoundary() {
        ClaimDetails details = new TransactionClaimDetails(purchase.getId(), null);

        assertTrue(validator.validateFiling(filing(details).incidentDate(NOW.minus(Duration.ofDays(30))).build())
                .isEmpty());
        assertEquals(List.of(ClaimFailureCode.CLAIM_WINDOW_EXPIRED), codes(validator.validateFiling(
                filing(details).incidentDate(NOW.minus(Duration.ofDays(31))).build())));
    }

    @Test
    @DisplayName("Incident in the future is invalid")
    void testFutureIncident() {
        List<ClaimFailure> failures = validator.validateFiling(filing(new TransactionClaimDetails(purchase.getId(), null))
                .incidentDate(NOW.plusSeconds(60)).build());

        assertEquals(List.of(ClaimFailureCode.INVALID_CLAIM_DETAILS), codes(failures));
    }

    @Test
    @DisplayName("Claim limit counts approved claims in the window")
    void testClaimLimit() {
        policy = policy.toBuilder().maxClaimsCount(2).build();
        ClaimDetails details = new TransactionClaimDetails(purchase.getId(), null);

        assertTrue(validator.validateFiling(filing(details).policy(policy).claimsInWindow(1).build()).isEmpty());
        assertEquals(List.of(ClaimFailureCode.CLAIM_LIMIT_EXCEEDED),
                codes(validator.validateFiling(filing(details).policy(policy).claimsInWindow(2).build())));
    }

    @Test
    @DisplayName("Zero claims allowed means every claim is over the limit")
    void testZeroClaimLimit() {
        policy = policy.toBuilder().maxClaimsCount(0).build();

        assertTrue(codes(validator.validateFiling(filing(new TransactionClaimDetails(purchase.getId(), null))
                .policy(policy).build())).contains(ClaimFailureCode.CLAIM_LIMIT_EXCEEDED));
    }

    @Test
    @DisplayName("Suspended enrollment with unpaid premium reports both problems")
    void testEnrollmentState() {
        Enrollment suspended = enrollment;
        for (int i = 0; i < 7; i++) {
            suspended = suspended.markUnpaid(7);
        }

        List<ClaimFailureCode> codes = codes(validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), null)).enrollment(suspended).build()));

        assertEquals(List.of(ClaimFailureCode.ENROLLMENT_NOT_ACTIVE, ClaimFailureCode.PAYMENT_NOT_CURRENT), codes);
    }

    @Test
    @DisplayName("Claim for someone else's enrollment is an ownership mismatch")
    void testEnrollmentOwnership() {
        List<ClaimFailureCode> codes = codes(validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), null)).subjectId(UUID.randomUUID()).build()));

        assertTrue(codes.contains(ClaimFailureCode.OWNERSHIP_MISMATCH));
    }

    @Test
    @DisplayName("Requested amount is capped by the entry and the policy maximum")
    void testRequestedAmountCaps() {
        policy = policy.toBuilder().maxClaimAmount(new BigDecimal("30")).build();

        List<ClaimFailure> failures = validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), new BigDecimal("60"))).policy(policy).build());

        assertEquals(List.of(ClaimFailureCode.PAYOUT_CAP_EXCEEDED, ClaimFailureCode.PAYOUT_CAP_EXCEEDED), codes(failures));
        assertEquals(List.of(ClaimFailureCode.INVALID_AMOUNT), codes(validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), BigDecimal.ZERO)).build())));
    }

    @Test
    @DisplayName("Details must match the policy's claim type")
    void testDetailsMismatch() {
        Policy inKind = policy(ClaimType.NON_MONETARY).build();

        assertEquals(List.of(ClaimFailureCode.INVALID_CLAIM_DETAILS), codes(validator.validateFiling(
                filing(new MonetaryClaimDetails(new BigDecimal("5"))).policy(inKind).linkedEntry(null).build())));
        assertEquals(List.of(ClaimFailureCode.INVALID_CLAIM_DETAILS), codes(validator.validateFiling(
                filing(new InKindClaimDetails(" ")).policy(inKind).linkedEntry(null).build())));
        assertEquals(List.of(ClaimFailureCode.TRANSACTION_REQUIRED), codes(validator.validateFiling(
                filing(new MonetaryClaimDetails(new BigDecimal("5"))).linkedEntry(null).build())));
    }

    @Test
    @DisplayName("Negative policy terms are reported as misconfiguration")
    void testMisconfiguredPolicy() {
        policy = policy.toBuilder().claimTimeLimitDays(-1).maxClaimAmount(new BigDecimal("-5")).build();

        List<ClaimFailureCode> codes = codes(validator.validateFiling(
                filing(new TransactionClaimDetails(purchase.getId(), null)).policy(policy).build()));

        assertEquals(2, codes.stream().filter(code -> code == ClaimFailureCode.POLICY_MISCONFIGURED).count());
    }

    @Test
    @DisplayName("Approval re-checks the void flag and ownership of the linked entry")
    void testApprovalLinkedEntry() {
        LedgerEntry voidedForeign = entry(UUID.randomUUID(), "-50.00", true);

        List<ClaimFailureCode> codes = codes(validator.validateApproval(
                filing(new TransactionClaimDetails(voidedForeign.getId(), null))
                    .linkedEntry(voidedForeign)
                    .approvedAmount(new BigDecimal("50"))
                    .build()));

        assertEquals(List.of(ClaimFailureCode.LINKED_TRANSACTION_VOIDED, ClaimFailureCode.OWNERSHIP_MISMATCH), codes);
    }

    @Test
    @DisplayName("Approval re-checks enrollment status and coverage")
    void testApprovalEnrollmentStanding() {
        Enrollment cancelled = enrollment.cancel(NOW);
        List<ClaimFailureCode> codes = codes(validator.validateApproval(
                filing(new TransactionClaimDetails(purchase.getId(), null))
                    .enrollment(cancelled)
                    .approvedAmount(new BigDecimal("50"))
                    .build()));
        assertEquals(List.of(ClaimFailureCode.ENROLLMENT_NOT_ACTIVE), codes);

        Enrollment suspended = enrollment.markUnpaid(1);
        assertEquals(List.of(ClaimFailureCode.ENROLLMENT_NOT_ACTIVE, ClaimFailureCode.PAYMENT_NOT_CURRENT),
                codes(validator.validateApproval(filing(new TransactionClaimDetails(purchase.getId(), null))
                    .enrollment(suspended)
                    .approvedAmount(new BigDecimal("50"))
                    .build())));

        Enrollment notCovered = Enrollment.create(UUID.randomUUID(), subjectId, policy, null, NOW);
        assertEquals(List.of(ClaimFailureCode.COVERAGE_NOT_STARTED),
                codes(validator.validateApproval(filing(new TransactionClaimDetails(purchase.getId(), null))
                    .enrollment(notCovered)
                    .approvedAmount(new BigDecimal("50"))
                    .build())));
    }

    @Test
    @DisplayName("Approval window is measured from the filing date, not the decision date")
    void testApprovalWindowUsesFiledDate() {
        ClaimCheck check = filing(new TransactionClaimDetails(purchase.getId(), null))
            .incidentDate(NOW.minus(Duration.ofDays(29)))
            .filedDate(NOW)
            .now(NOW.plus(Duration.ofDays(10)))
            .approvedAmount(new BigDecimal("50"))
            .build();

        assertTrue(validator.validateApproval(check).isEmpty());
    }

    @Test
    @DisplayName("Period payout cap includes payouts already approved in the window")
    void testPeriodPayoutCap() {
        policy = policy.toBuilder().maxPayoutPerPeriod(new BigDecimal("60")).build();
        ClaimCheck.ClaimCheckBuilder check = filing(new TransactionClaimDetails(purchase.getId(), null))
            .policy(policy)
            .approvedAmount(new BigDecimal("30"));

        assertTrue(validator.validateApproval(check.approvedInWindow(new BigDecimal("30")).build()).isEmpty());
        assertEquals(List.of(ClaimFailureCode.PERIOD_PAYOUT_CAP_EXCEEDED),
                codes(validator.validateApproval(check.approvedInWindow(new BigDecimal("30.01")).build())));
    }

    @Test
    @DisplayName("In-kind approval ignores amounts and linked entries")
    void testInKindApproval() {
        Policy inKind = policy(ClaimType.NON_MONETARY).maxClaimAmount(BigDecimal.ONE).build();

        List<ClaimFailure> failures = validator.validateApproval(filing(new InKindClaimDetails("Pencil case"))
            .policy(inKind)
            .linkedEntry(null)
            .approvedAmount(null)
            .build());

        assertTrue(failures.isEmpty());
    }

    @Test
    @DisplayName("Base amount is the absolute entry amount or the requested amount")
    void testBaseAmount() {
        assertEquals(0, new BigDecimal("50.00").compareTo(
                validator.baseAmount(new TransactionClaimDetails(purchase.getId(), null), purchase)));
        assertEquals(0, new BigDecimal("7").compareTo(
                validator.baseAmount(new MonetaryClaimDetails(new BigDecimal("7")), null)));
        assertNull(validator.baseAmount(new InKindClaimDetails("Book"), null));
    }
}
