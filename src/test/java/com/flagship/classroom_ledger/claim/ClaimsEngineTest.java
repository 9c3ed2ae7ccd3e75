package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.EntryKind;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import com.flagship.classroom_ledger.outbox.AggregateType;
import com.flagship.classroom_ledger.outbox.OutboxEvent;
import com.flagship.classroom_ledger.outbox.OutboxService;
import com.flagship.classroom_ledger.policy.ClaimType;
import com.flagship.classroom_ledger.policy.Policy;
import com.flagship.classroom_ledger.support.PostgresIntegrationTest;
import com.flagship.classroom_ledger.tenant.CrossTenantViolationException;
import com.flagship.classroom_ledger.tenant.TenantScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Filing, deciding and paying claims against a real database.
 *
 * Tries to break the invariants the engine promises:
 * - one open or paid claim per ledger entry, even under concurrent filing
 * - a voided entry can never be paid out
 * - approval and payout commit together
 * - nothing crosses a tenant boundary
 */
class ClaimsEngineTest extends PostgresIntegrationTest {

    @Autowired
    private ClaimsEngine claimsEngine;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID subjectId;
    private UUID reviewerId;

    @BeforeEach
    void setUp() {
        subjectId = UUID.randomUUID();
        reviewerId = UUID.randomUUID();
    }

    private ClaimResult fileTransactionClaim(Enrollment enrollment, UUID entryId, Instant incidentDate) {
        return claimsEngine.file(FileClaimRequest.builder()
            .subjectId(enrollment.getSubjectId())
            .enrollmentId(enrollment.getId())
            .details(new TransactionClaimDetails(entryId, null))
            .incidentDate(incidentDate)
            .description("Lost lunch money")
            .build(), scope);
    }

    private ClaimResult fileMonetaryClaim(Enrollment enrollment, String amount) {
        return claimsEngine.file(FileClaimRequest.builder()
            .subjectId(enrollment.getSubjectId())
            .enrollmentId(enrollment.getId())
            .details(new MonetaryClaimDetails(new BigDecimal(amount)))
            .incidentDate(clock.instant().minus(Duration.ofDays(1)))
            .build(), scope);
    }

    private ClaimResult approve(UUID claimId, BigDecimal amount) {
        return claimsEngine.decide(DecideClaimRequest.builder()
            .claimId(claimId)
            .reviewerId(reviewerId)
            .outcome(ClaimOutcome.APPROVE)
            .approvedAmount(amount)
            .notes("Looks fine")
            .build(), scope);
    }

    private List<LedgerEntry> payoutsOf(UUID subject) {
        return ledgerService.listForSubject(subject, scope).stream()
            .filter(entry -> entry.getKind() == EntryKind.PAYOUT)
            .toList();
    }

    @Nested
    @DisplayName("1. Filing")
    class FilingTests {

        @Test
        @DisplayName("1.1 Claim against an eligible entry is created as PENDING")
        void testFileEligibleTransactionClaim() {
            printTestHeader("File Eligible Transaction Claim");

            // Given: coverage started 10 days ago after a 7 day waiting period
            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY, terms -> terms.waitingPeriodDays(7));
            Enrollment enrollment = enroll(subjectId, policy);
            clock.advanceDays(17);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-50.00");
            printInput("Ledger entry", purchase.getId() + " amount=" + purchase.getAmount());

            // When
            ClaimResult result = fileTransactionClaim(enrollment, purchase.getId(), clock.instant().minus(Duration.ofDays(1)));

            // Then
            assertTrue(result.isSuccess(), "Filing should succeed: " + result.getFailures());
            Claim claim = result.getClaim();
            printOutput("Claim", claim.getId() + " status=" + claim.getStatus());
            assertEquals(ClaimStatus.PENDING, claim.getStatus());
            assertEquals(purchase.getId(), claim.getLedgerEntryId());
            assertEquals(tenantId, claim.getTenantId());
            assertEquals(policy.getId(), claim.getPolicyId());
            assertEquals(subjectId, claim.getSubjectId());

            List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateType.CLAIM, claim.getId());
            assertEquals(1, events.size());
            assertEquals("ClaimFiled", events.get(0).getEventType());
            printSuccess("Pending claim created with ClaimFiled event");
        }

        @Test
        @DisplayName("1.2 Claim filed 31 days after the incident with a 30 day window is refused")
        void testClaimWindowExpired() {
            printTestHeader("Claim Window Expired");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            clock.advanceDays(40);

            ClaimResult result = claimsEngine.file(FileClaimRequest.builder()
                .subjectId(subjectId)
                .enrollmentId(enrollment.getId())
                .details(new MonetaryClaimDetails(new BigDecimal("5.00")))
                .incidentDate(clock.instant().minus(Duration.ofDays(31)))
                .build(), scope);

            printOutput("Failures", result.getFailures());
            assertFalse(result.isSuccess());
            assertTrue(result.hasFailure(ClaimFailureCode.CLAIM_WINDOW_EXPIRED));
            assertNull(result.getClaim());
            assertTrue(claimsEngine.listForSubject(subjectId, scope).isEmpty(), "Nothing may be persisted");
            printSuccess("Expired claim refused, nothing persisted");
        }

        @Test
        @DisplayName("1.3 Every applicable failure is reported at once")
        void testFailuresAreAccumulated() {
            printTestHeader("Failures Accumulated");

            // Given: 7 day waiting period not yet over, incident outside the window, foreign entry
            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY, terms -> terms
                .waitingPeriodDays(7)
                .claimTimeLimitDays(2));
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry someoneElses = append(UUID.randomUUID(), EntryKind.PURCHASE, "-20.00");

            ClaimResult result = fileTransactionClaim(enrollment, someoneElses.getId(),
                    clock.instant().minus(Duration.ofDays(5)));

            printOutput("Failures", result.getFailures());
            assertTrue(result.hasFailure(ClaimFailureCode.COVERAGE_NOT_STARTED));
            assertTrue(result.hasFailure(ClaimFailureCode.CLAIM_WINDOW_EXPIRED));
            assertTrue(result.hasFailure(ClaimFailureCode.OWNERSHIP_MISMATCH));
            assertEquals(3, result.getFailures().size());
            printSuccess("All three failures reported together");
        }

        @Test
        @DisplayName("1.4 Transaction policy without a ledger entry is refused")
        void testTransactionRequired() {
            printTestHeader("Transaction Required");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);

            ClaimResult result = fileMonetaryClaim(enrollment, "10.00");

            assertTrue(result.hasFailure(ClaimFailureCode.TRANSACTION_REQUIRED));
            printSuccess("Claim without entry refused");
        }

        @Test
        @DisplayName("1.5 Claim against a voided entry is refused")
        void testFileAgainstVoidedEntry() {
            printTestHeader("File Against Voided Entry");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-15.00");
            ledgerService.voidEntry(purchase.getId(), reviewerId, scope);

            ClaimResult result = fileTransactionClaim(enrollment, purchase.getId(), clock.instant());

            assertTrue(result.hasFailure(ClaimFailureCode.LINKED_TRANSACTION_VOIDED));
            printSuccess("Voided entry cannot be claimed");
        }

        @Test
        @DisplayName("1.6 Second claim on the same entry fails with TransactionAlreadyClaimed")
        void testSecondClaimOnSameEntry() {
            printTestHeader("Second Claim On Same Entry");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-15.00");

            assertTrue(fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).isSuccess());

            TransactionAlreadyClaimedException e = assertThrows(TransactionAlreadyClaimedException.class,
                () -> fileTransactionClaim(enrollment, purchase.getId(), clock.instant()));
            printExpectedException("TransactionAlreadyClaimedException", e.getMessage());
            assertEquals(purchase.getId(), e.getLedgerEntryId());
            assertEquals(1, claimsEngine.listForSubject(subjectId, scope).size());
        }

        @Test
        @DisplayName("1.7 A rejected claim frees the entry for a new claim")
        void testRejectedClaimFreesEntry() {
            printTestHeader("Rejected Claim Frees Entry");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-15.00");

            Claim first = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();
            claimsEngine.decide(DecideClaimRequest.builder()
                .claimId(first.getId())
                .reviewerId(reviewerId)
                .outcome(ClaimOutcome.REJECT)
                .rejectionReason("Missing receipt")
                .build(), scope);

            ClaimResult second = fileTransactionClaim(enrollment, purchase.getId(), clock.instant());

            assertTrue(second.isSuccess());
            assertNotEquals(first.getId(), second.getClaim().getId());
            printSuccess("New claim accepted after rejection");
        }

        @Test
        @DisplayName("1.8 Third claim in the period with maxClaimsCount=2 is refused")
        void testClaimLimitExceeded() {
            printTestHeader("Claim Limit Exceeded");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY, terms -> terms.maxClaimsCount(2));
            Enrollment enrollment = enroll(subjectId, policy);

            for (int i = 0; i < 2; i++) {
                Claim claim = fileMonetaryClaim(enrollment, "5.00").getClaim();
                ClaimResult approved = approve(claim.getId(), null);
                assertTrue(approved.isSuccess(), "Approval " + i + " failed: " + approved.getFailures());
            }

            ClaimResult third = fileMonetaryClaim(enrollment, "5.00");

            printOutput("Failures", third.getFailures());
            assertTrue(third.hasFailure(ClaimFailureCode.CLAIM_LIMIT_EXCEEDED));
            printSuccess("Limit enforced within the rolling month");
        }

        @Test
        @DisplayName("1.9 Claims outside the rolling window no longer count towards the limit")
        void testClaimLimitWindowRolls() {
            printTestHeader("Claim Limit Window Rolls");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY, terms -> terms.maxClaimsCount(1));
            Enrollment enrollment = enroll(subjectId, policy);
            Claim claim = fileMonetaryClaim(enrollment, "5.00").getClaim();
            assertTrue(approve(claim.getId(), null).isSuccess());

            assertTrue(fileMonetaryClaim(enrollment, "5.00").hasFailure(ClaimFailureCode.CLAIM_LIMIT_EXCEEDED));

            clock.advanceDays(31);
            enrollmentService.recordPayment(enrollment.getId(), scope);

            assertTrue(fileMonetaryClaim(enrollment, "5.00").isSuccess());
            printSuccess("Window is rolling, not calendar aligned");
        }
    }

    @Nested
    @DisplayName("2. Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("2.1 Concurrent claims on one entry: exactly one succeeds")
        void testConcurrentFilingOnSameEntry() throws InterruptedException {
            printTestHeader("Concurrent Filing On Same Entry");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-50.00");

            int threadCount = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            AtomicInteger successes = new AtomicInteger();
            AtomicInteger alreadyClaimed = new AtomicInteger();
            List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        ClaimResult result = fileTransactionClaim(enrollment, purchase.getId(), START);
                        if (result.isSuccess()) {
                            successes.incrementAndGet();
                        }
                    } catch (TransactionAlreadyClaimedException e) {
                        alreadyClaimed.incrementAndGet();
                    } catch (Throwable t) {
                        unexpected.add(t);
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Successes", successes.get());
            printOutput("TransactionAlreadyClaimed", alreadyClaimed.get());
            assertTrue(unexpected.isEmpty(), "Unexpected errors: " + unexpected);
            assertEquals(1, successes.get());
            assertEquals(threadCount - 1, alreadyClaimed.get());

            Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM insurance_claims WHERE ledger_entry_id = ?", Integer.class, purchase.getId());
            assertEquals(1, rows);
            printSuccess("Storage-level uniqueness held under contention");
        }

        @Test
        @DisplayName("2.2 Void racing a decision: the claim is paid only if the void came after it")
        void testVoidRacingApproval() throws Exception {
            printTestHeader("Void Racing Approval");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            int rounds = 10;
            int paidRounds = 0;

            try {
                for (int round = 0; round < rounds; round++) {
                    LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-5.00");
                    Claim pending = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();

                    CountDownLatch startLatch = new CountDownLatch(1);
                    Future<ClaimResult> decision = executor.submit(() -> {
                        startLatch.await();
                        return approve(pending.getId(), null);
                    });
                    Future<LedgerEntry> voiding = executor.submit(() -> {
                        startLatch.await();
                        return ledgerService.voidEntry(purchase.getId(), reviewerId, scope);
                    });
                    startLatch.countDown();

                    ClaimResult result = decision.get(30, TimeUnit.SECONDS);
                    assertTrue(voiding.get(30, TimeUnit.SECONDS).isVoided());

                    Claim after = claimsEngine.get(pending.getId(), scope);
                    List<LedgerEntry> payouts = payoutsOf(subjectId).stream()
                        .filter(entry -> (ClaimsEngine.PAYOUT_KEY_PREFIX + pending.getId())
                            .equals(entry.getIdempotencyKey()))
                        .toList();

                    if (after.getStatus() == ClaimStatus.PAID) {
                        paidRounds++;
                        assertTrue(result.isSuccess());
                        assertEquals(1, payouts.size());
                        // the void must have been serialised behind the decision
                        long paidSequence = sequenceOf(AggregateType.CLAIM, pending.getId(), "ClaimPaid");
                        long voidSequence = sequenceOf(AggregateType.LEDGER_ENTRY, purchase.getId(), "LedgerEntryVoided");
                        assertTrue(voidSequence > paidSequence,
                            "Round " + round + ": paid against an entry voided before the decision");
                    } else {
                        assertEquals(ClaimStatus.PENDING, after.getStatus());
                        assertTrue(result.hasFailure(ClaimFailureCode.LINKED_TRANSACTION_VOIDED));
                        assertTrue(payouts.isEmpty(), "Round " + round + ": payout written for a refused claim");
                    }
                }
            } finally {
                executor.shutdownNow();
            }

            printOutput("Rounds paid before the void", paidRounds + "/" + rounds);
            printSuccess("No payout ever followed a committed void");
        }

        private long sequenceOf(AggregateType aggregateType, UUID aggregateId, String eventType) {
            return outboxService.getEventsForAggregate(aggregateType, aggregateId).stream()
                .filter(event -> eventType.equals(event.getEventType()))
                .findFirst()
                .orElseThrow(() -> new AssertionError(eventType + " missing for " + aggregateId))
                .getSequenceNumber();
        }
    }

    @Nested
    @DisplayName("3. Deciding")
    class DecisionTests {

        @Test
        @DisplayName("3.1 Approving a monetary claim writes the payout and marks it PAID")
        void testApproveWritesPayout() {
            printTestHeader("Approve Writes Payout");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-50.00");
            Claim pending = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();
            BigDecimal balanceBefore = ledgerService.currentBalance(subjectId, AccountBucket.CHECKING, scope);

            // When: no amount given, defaults to the entry's absolute amount
            ClaimResult result = approve(pending.getId(), null);

            // Then
            assertTrue(result.isSuccess(), "Approval failed: " + result.getFailures());
            Claim paid = result.getClaim();
            printOutput("Claim", paid.getStatus() + " payout=" + paid.getPayoutEntryId());
            assertEquals(ClaimStatus.PAID, paid.getStatus());
            assertEquals(0, new BigDecimal("50.00").compareTo(paid.getApprovedAmount()));
            assertNotNull(paid.getPayoutEntryId());

            LedgerEntry payout = ledgerService.get(paid.getPayoutEntryId(), scope);
            assertEquals(EntryKind.PAYOUT, payout.getKind());
            assertEquals(subjectId, payout.getSubjectId());
            assertEquals(tenantId, payout.getTenantId());
            assertEquals(0, new BigDecimal("50.00").compareTo(payout.getAmount()));
            assertEquals(ClaimsEngine.PAYOUT_KEY_PREFIX + paid.getId(), payout.getIdempotencyKey());

            BigDecimal balanceAfter = ledgerService.currentBalance(subjectId, AccountBucket.CHECKING, scope);
            assertEquals(0, balanceBefore.add(new BigDecimal("50.00")).compareTo(balanceAfter));

            List<String> eventTypes = outboxService.getEventsForAggregate(AggregateType.CLAIM, paid.getId())
                .stream().map(OutboxEvent::getEventType).toList();
            assertEquals(List.of("ClaimFiled", "ClaimApproved", "ClaimPaid"), eventTypes);
            printSuccess("Claim PAID with linked payout entry");
        }

        @Test
        @DisplayName("3.2 Voiding the entry before the decision blocks approval")
        void testVoidBeforeDecision() {
            printTestHeader("Void Before Decision");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-50.00");
            Claim pending = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();

            ledgerService.voidEntry(purchase.getId(), reviewerId, scope);
            ClaimResult result = approve(pending.getId(), null);

            printOutput("Failures", result.getFailures());
            assertFalse(result.isSuccess());
            assertTrue(result.hasFailure(ClaimFailureCode.LINKED_TRANSACTION_VOIDED));
            assertEquals(ClaimStatus.PENDING, claimsEngine.get(pending.getId(), scope).getStatus());
            assertTrue(payoutsOf(subjectId).isEmpty());
            printSuccess("Claim stays PENDING, no payout written");
        }

        @Test
        @DisplayName("3.3 Approved amount above maxClaimAmount is refused without a payout")
        void testPayoutCapExceeded() {
            printTestHeader("Payout Cap Exceeded");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY,
                    terms -> terms.maxClaimAmount(new BigDecimal("30.00")));
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-40.00");
            Claim pending = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();

            ClaimResult result = approve(pending.getId(), new BigDecimal("40.00"));

            assertTrue(result.hasFailure(ClaimFailureCode.PAYOUT_CAP_EXCEEDED));
            assertEquals(ClaimStatus.PENDING, result.getClaim().getStatus());
            assertTrue(payoutsOf(subjectId).isEmpty());

            // A smaller amount inside the cap goes through
            ClaimResult retry = approve(pending.getId(), new BigDecimal("30.00"));
            assertTrue(retry.isSuccess());
            assertEquals(1, payoutsOf(subjectId).size());
            printSuccess("Cap enforced; reviewer can retry with a lower amount");
        }

        @Test
        @DisplayName("3.4 Amount above the linked entry is refused")
        void testAmountAboveLinkedEntry() {
            printTestHeader("Amount Above Linked Entry");

            Policy policy = createPolicy(ClaimType.TRANSACTION_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            LedgerEntry purchase = append(subjectId, EntryKind.PURCHASE, "-12.00");
            Claim pending = fileTransactionClaim(enrollment, purchase.getId(), clock.instant()).getClaim();

            ClaimResult result = approve(pending.getId(), new BigDecimal("12.01"));

            assertTrue(result.hasFailure(ClaimFailureCode.PAYOUT_CAP_EXCEEDED));
        }

        @Test
        @DisplayName("3.5 Payment status is re-read at decision time")
        void testPaymentNotCurrentAtDecision() {
            printTestHeader("Payment Not Current At Decision");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "8.00").getClaim();

            enrollmentService.markUnpaid(enrollment.getId(), scope);
            ClaimResult result = approve(pending.getId(), null);

            assertTrue(result.hasFailure(ClaimFailureCode.PAYMENT_NOT_CURRENT));
            assertTrue(payoutsOf(subjectId).isEmpty());

            enrollmentService.recordPayment(enrollment.getId(), scope);
            assertTrue(approve(pending.getId(), null).isSuccess());
            printSuccess("Fresh enrollment state used on every decision");
        }

        @Test
        @DisplayName("3.10 Cancelling the enrollment after filing blocks approval")
        void testCancelledEnrollmentAtDecision() {
            printTestHeader("Cancelled Enrollment At Decision");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "8.00").getClaim();

            // cancel keeps paymentCurrent, so only the status check can catch this
            Enrollment cancelled = enrollmentService.cancel(enrollment.getId(), scope);
            assertTrue(cancelled.isPaymentCurrent());
            ClaimResult result = approve(pending.getId(), null);

            printOutput("Failures", result.getFailures());
            assertFalse(result.isSuccess());
            assertTrue(result.hasFailure(ClaimFailureCode.ENROLLMENT_NOT_ACTIVE));
            assertEquals(ClaimStatus.PENDING, claimsEngine.get(pending.getId(), scope).getStatus());
            assertTrue(payoutsOf(subjectId).isEmpty());
            assertEquals(List.of("ClaimFiled"), outboxService.getEventsForAggregate(AggregateType.CLAIM, pending.getId())
                .stream().map(OutboxEvent::getEventType).toList());
            printSuccess("No payout against a terminated enrollment");
        }

        @Test
        @DisplayName("3.6 Payouts in the period are capped by maxPayoutPerPeriod")
        void testPeriodPayoutCap() {
            printTestHeader("Period Payout Cap");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY,
                    terms -> terms.maxPayoutPerPeriod(new BigDecimal("50.00")));
            Enrollment enrollment = enroll(subjectId, policy);
            Claim first = fileMonetaryClaim(enrollment, "30.00").getClaim();
            Claim second = fileMonetaryClaim(enrollment, "30.00").getClaim();

            assertTrue(approve(first.getId(), null).isSuccess());
            ClaimResult result = approve(second.getId(), null);

            printOutput("Failures", result.getFailures());
            assertTrue(result.hasFailure(ClaimFailureCode.PERIOD_PAYOUT_CAP_EXCEEDED));
            assertTrue(approve(second.getId(), new BigDecimal("20.00")).isSuccess());
        }

        @Test
        @DisplayName("3.7 Rejection changes no ledger state")
        void testRejectWritesNothing() {
            printTestHeader("Reject Writes Nothing");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "8.00").getClaim();
            int entriesBefore = ledgerService.listForSubject(subjectId, scope).size();

            ClaimResult result = claimsEngine.decide(DecideClaimRequest.builder()
                .claimId(pending.getId())
                .reviewerId(reviewerId)
                .outcome(ClaimOutcome.REJECT)
                .rejectionReason("Not covered")
                .build(), scope);

            assertTrue(result.isSuccess());
            assertEquals(ClaimStatus.REJECTED, result.getClaim().getStatus());
            assertEquals("Not covered", result.getClaim().getRejectionReason());
            assertEquals(reviewerId, result.getClaim().getReviewerId());
            assertEquals(entriesBefore, ledgerService.listForSubject(subjectId, scope).size());
        }

        @Test
        @DisplayName("3.8 Deciding a decided claim fails with ClaimNotPending")
        void testDecideTwice() {
            printTestHeader("Decide Twice");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "8.00").getClaim();
            assertTrue(approve(pending.getId(), null).isSuccess());

            ClaimNotPendingException e = assertThrows(ClaimNotPendingException.class,
                () -> approve(pending.getId(), null));
            printExpectedException("ClaimNotPendingException", e.getMessage());
            assertEquals(1, payoutsOf(subjectId).size());
        }

        @Test
        @DisplayName("3.9 In-kind claims are approved without a ledger entry and fulfilled later")
        void testInKindClaimLifecycle() {
            printTestHeader("In-Kind Claim Lifecycle");

            Policy policy = createPolicy(ClaimType.NON_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            int entriesBefore = ledgerService.listForSubject(subjectId, scope).size();

            ClaimResult filed = claimsEngine.file(FileClaimRequest.builder()
                .subjectId(subjectId)
                .enrollmentId(enrollment.getId())
                .details(new InKindClaimDetails("Replacement calculator"))
                .incidentDate(clock.instant())
                .build(), scope);
            assertTrue(filed.isSuccess(), "Filing failed: " + filed.getFailures());

            ClaimResult approved = approve(filed.getClaim().getId(), new BigDecimal("99.00"));
            assertTrue(approved.isSuccess());
            assertEquals(ClaimStatus.APPROVED, approved.getClaim().getStatus());
            assertNull(approved.getClaim().getApprovedAmount());

            clock.advanceDays(1);
            Claim fulfilled = claimsEngine.fulfill(filed.getClaim().getId(), reviewerId, scope);

            assertEquals(ClaimStatus.PAID, fulfilled.getStatus());
            assertEquals(clock.instant(), fulfilled.getFulfilledDate());
            assertNull(fulfilled.getPayoutEntryId());
            assertEquals(reviewerId, claimsEngine.get(fulfilled.getId(), scope).getFulfilledBy());
            OutboxEvent paidEvent = outboxService.getEventsForAggregate(AggregateType.CLAIM, fulfilled.getId())
                .stream().filter(event -> "ClaimPaid".equals(event.getEventType())).findFirst().orElseThrow();
            assertTrue(paidEvent.getPayload().contains(reviewerId.toString()), paidEvent.getPayload());
            assertEquals(entriesBefore, ledgerService.listForSubject(subjectId, scope).size());

            assertThrows(IllegalStateException.class,
                () -> claimsEngine.fulfill(filed.getClaim().getId(), reviewerId, scope));
            printSuccess("In-kind claim PAID without touching the ledger");
        }
    }

    @Nested
    @DisplayName("4. Tenant Isolation")
    class TenantIsolationTests {

        @Test
        @DisplayName("4.1 Filing under another tenant's enrollment fails before anything is written")
        void testFileAcrossTenants() {
            printTestHeader("File Across Tenants");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            TenantScope otherTenant = TenantScope.of(UUID.randomUUID());

            CrossTenantViolationException e = assertThrows(CrossTenantViolationException.class,
                () -> claimsEngine.file(FileClaimRequest.builder()
                    .subjectId(subjectId)
                    .enrollmentId(enrollment.getId())
                    .details(new MonetaryClaimDetails(new BigDecimal("5.00")))
                    .incidentDate(clock.instant())
                    .build(), otherTenant));

            printExpectedException("CrossTenantViolationException", e.getMessage());
            assertEquals("CROSS_TENANT_VIOLATION", e.getCode());
            assertTrue(claimsEngine.listForSubject(subjectId, scope).isEmpty());
        }

        @Test
        @DisplayName("4.2 Reading or deciding another tenant's claim fails")
        void testDecideAcrossTenants() {
            printTestHeader("Decide Across Tenants");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "5.00").getClaim();
            TenantScope otherTenant = TenantScope.of(UUID.randomUUID());

            assertThrows(CrossTenantViolationException.class,
                () -> claimsEngine.get(pending.getId(), otherTenant));
            assertThrows(CrossTenantViolationException.class,
                () -> claimsEngine.decide(DecideClaimRequest.builder()
                    .claimId(pending.getId())
                    .reviewerId(reviewerId)
                    .outcome(ClaimOutcome.APPROVE)
                    .build(), otherTenant));

            assertEquals(ClaimStatus.PENDING, claimsEngine.get(pending.getId(), scope).getStatus());
            assertTrue(claimsEngine.listPending(otherTenant).isEmpty());
        }
    }

    @Nested
    @DisplayName("5. Payout Recovery")
    class RecoveryTests {

        @Test
        @DisplayName("5.1 Approved claim without payout is detected and paid exactly once")
        void testResumeStalledPayout() {
            printTestHeader("Resume Stalled Payout");

            Policy policy = createPolicy(ClaimType.LEGACY_MONETARY);
            Enrollment enrollment = enroll(subjectId, policy);
            Claim pending = fileMonetaryClaim(enrollment, "12.00").getClaim();

            // Simulate a writer that died between approval and payout
            jdbcTemplate.update(
                "UPDATE insurance_claims SET status = 'APPROVED', approved_amount = ?, decision_date = ?, " +
                "reviewer_id = ? WHERE id = ?",
                new BigDecimal("12.00"), Timestamp.from(clock.instant()), reviewerId, pending.getId());
            assertTrue(claimsEngine.get(pending.getId(), scope).isAwaitingPayout());

            Claim resumed = claimsEngine.resumePayout(pending.getId());
            Claim again = claimsEngine.resumePayout(pending.getId());

            printOutput("Resumed", resumed.getStatus() + " payout=" + resumed.getPayoutEntryId());
            assertEquals(ClaimStatus.PAID, resumed.getStatus());
            assertEquals(resumed.getPayoutEntryId(), again.getPayoutEntryId());
            List<LedgerEntry> payouts = payoutsOf(subjectId);
            assertEquals(1, payouts.size());
            assertEquals(0, new BigDecimal("12.00").compareTo(payouts.get(0).getAmount()));
            printSuccess("Payout written once, second attempt is a no-op");
        }
    }
}
