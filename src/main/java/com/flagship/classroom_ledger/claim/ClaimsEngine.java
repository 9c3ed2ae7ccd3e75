package com.flagship.classroom_ledger.claim;

import com.flagship.classroom_ledger.claim.ClaimValidator.ClaimCheck;
import com.flagship.classroom_ledger.claim.event.ClaimApprovedEvent;
import com.flagship.classroom_ledger.claim.event.ClaimFiledEvent;
import com.flagship.classroom_ledger.claim.event.ClaimPaidEvent;
import com.flagship.classroom_ledger.claim.event.ClaimRejectedEvent;
import com.flagship.classroom_ledger.enrollment.Enrollment;
import com.flagship.classroom_ledger.enrollment.EnrollmentService;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.AppendEntryRequest;
import com.flagship.classroom_ledger.ledger.EntryKind;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import com.flagship.classroom_ledger.ledger.LedgerService;
import com.flagship.classroom_ledger.observability.AuditLogger;
import com.flagship.classroom_ledger.observability.ClaimMetrics;
import com.flagship.classroom_ledger.outbox.AggregateType;
import com.flagship.classroom_ledger.outbox.OutboxService;
import com.flagship.classroom_ledger.policy.ClaimPeriod;
import com.flagship.classroom_ledger.policy.Policy;
import com.flagship.classroom_ledger.policy.PolicyCatalogService;
import com.flagship.classroom_ledger.tenant.TenantGuard;
import com.flagship.classroom_ledger.tenant.TenantScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Files and decides insurance claims, and writes their payouts.
 *
 * Invariants:
 * 1. At most one non-rejected claim per ledger entry (partial unique index;
 *    the early existence check only improves the error)
 * 2. A monetary approval, its PAYOUT ledger entry and the PAID status commit
 *    in one transaction or not at all
 * 3. A voided entry is never paid out: the decision reads the entry FOR SHARE
 *    so a concurrent void either is seen or waits for the decision to commit
 * 4. Business-rule failures are returned, never thrown, and leave no trace
 *    in the database
 *
 * Lock order on approval is claim, enrollment, ledger entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimsEngine {

    static final String PAYOUT_KEY_PREFIX = "claim-payout:";
    private static final String ENTITY_TYPE = "Claim";

    private final ClaimPersistenceService persistence;
    private final ClaimValidator validator;
    private final EnrollmentService enrollmentService;
    private final PolicyCatalogService catalogService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final TenantGuard tenantGuard;
    private final AuditLogger auditLogger;
    private final ClaimMetrics metrics;
    private final Clock clock;

    /**
     * Files a new PENDING claim.
     *
     * @return the created claim, or the list of rule failures with nothing persisted
     * @throws com.flagship.classroom_ledger.enrollment.EnrollmentNotFoundException if the enrollment does not exist
     * @throws com.flagship.classroom_ledger.ledger.TransactionNotFoundException if the linked entry does not exist
     * @throws TransactionAlreadyClaimedException if the linked entry already has an open or paid claim
     * @throws com.flagship.classroom_ledger.tenant.CrossTenantViolationException if any referenced row is in another tenant
     */
    @Transactional
    public ClaimResult file(FileClaimRequest request, TenantScope scope) {
        Instant now = clock.instant();

        Enrollment enrollment = enrollmentService.get(request.getEnrollmentId(), scope);
        Policy policy = catalogService.get(enrollment.getPolicyId(), scope);

        LedgerEntry linkedEntry = null;
        if (policy.getClaimType() != null && policy.getClaimType().requiresLedgerEntry()
                && request.getDetails() instanceof TransactionClaimDetails transaction
                && transaction.getLedgerEntryId() != null) {
            linkedEntry = ledgerService.get(transaction.getLedgerEntryId(), scope);
            if (persistence.hasActiveClaimOn(linkedEntry.getId())) {
                TransactionAlreadyClaimedException e = new TransactionAlreadyClaimedException(linkedEntry.getId());
                auditAlreadyClaimed(e, scope);
                throw e;
            }
        }
        tenantGuard.checkRelated(scope, enrollment, policy, linkedEntry);

        ClaimCheck check = ClaimCheck.builder()
            .policy(policy)
            .enrollment(enrollment)
            .linkedEntry(linkedEntry)
            .subjectId(request.getSubjectId())
            .details(request.getDetails())
            .incidentDate(request.getIncidentDate())
            .filedDate(now)
            .now(now)
            .claimsInWindow(persistence.countTowardsLimitSince(scope.tenantId(), enrollment.getSubjectId(),
                    policy.getId(), windowStart(policy, now)))
            .build();

        List<ClaimFailure> failures = validator.validateFiling(check);
        if (!failures.isEmpty()) {
            recordFailures(failures);
            metrics.recordClaimFiled(request.getDetails() != null ? request.getDetails().getClaimType().name() : null,
                    "FAILED");
            log.info("Claim filing refused: enrollmentId={}, subjectId={}, failures={}",
                    enrollment.getId(), request.getSubjectId(), codes(failures));
            return ClaimResult.failed(null, failures);
        }

        Claim claim = Claim.file(UUID.randomUUID(), enrollment, request.getDetails(), request.getIncidentDate(),
                request.getDescription(), request.getComments(), now);
        Claim saved;
        try {
            saved = persistence.insert(claim);
        } catch (TransactionAlreadyClaimedException e) {
            auditAlreadyClaimed(e, scope);
            throw e;
        }

        outboxService.saveEvent(AggregateType.CLAIM, saved.getId(), saved.getTenantId(),
                ClaimFiledEvent.EVENT_TYPE, ClaimFiledEvent.fromClaim(saved));

        metrics.recordClaimFiled(saved.getClaimType().name(), saved.getStatus().name());
        log.info("Claim filed: claimId={}, enrollmentId={}, subjectId={}, type={}, ledgerEntryId={}",
                saved.getId(), saved.getEnrollmentId(), saved.getSubjectId(), saved.getClaimType(),
                saved.getLedgerEntryId());
        return ClaimResult.success(saved);
    }

    /**
     * Approves or rejects a PENDING claim. A monetary approval writes the
     * payout in the same transaction and returns the claim as PAID.
     *
     * @return the decided claim, or the unchanged PENDING claim with the rule failures
     * @throws ClaimNotFoundException if the claim does not exist
     * @throws ClaimNotPendingException if the claim was already decided
     */
    @Transactional
    public ClaimResult decide(DecideClaimRequest request, TenantScope scope) {
        Claim claim = lockClaim(request.getClaimId(), scope);
        if (claim.getStatus() != ClaimStatus.PENDING) {
            throw new ClaimNotPendingException(claim.getId(), claim.getStatus());
        }

        if (request.getOutcome() == ClaimOutcome.REJECT) {
            return ClaimResult.success(reject(claim, request));
        }
        return approve(claim, request, scope);
    }

    /**
     * Hands over the item of an approved in-kind claim and records who did.
     * No ledger entry.
     *
     * @throws IllegalStateException if the claim is monetary or not APPROVED
     */
    @Transactional
    public Claim fulfill(UUID claimId, UUID reviewerId, TenantScope scope) {
        Claim claim = lockClaim(claimId, scope);
        Instant now = clock.instant();

        Claim fulfilled = persistence.update(claim.fulfill(reviewerId, now));
        outboxService.saveEvent(AggregateType.CLAIM, fulfilled.getId(), fulfilled.getTenantId(),
                ClaimPaidEvent.EVENT_TYPE, ClaimPaidEvent.fromClaim(fulfilled, now));

        auditLogger.claimFulfilled(fulfilled.getTenantId(), fulfilled.getId(), reviewerId);
        log.info("In-kind claim fulfilled: claimId={}, fulfilledBy={}", claimId, reviewerId);
        return fulfilled;
    }

    /**
     * Writes the missing payout of an approved monetary claim. A payout that
     * was already written under the claim's key is reused, not duplicated.
     *
     * @return the claim after the attempt; unchanged when nothing was missing
     */
    @Transactional
    public Claim resumePayout(UUID claimId) {
        Claim claim = persistence.findForUpdate(claimId)
            .orElseThrow(() -> new ClaimNotFoundException(claimId));
        if (!claim.isAwaitingPayout()) {
            log.debug("Claim {} needs no payout (status={})", claimId, claim.getStatus());
            return claim;
        }
        log.warn("Resuming payout for approved claim: claimId={}, amount={}", claimId, claim.getApprovedAmount());
        return writePayout(claim, TenantScope.of(claim.getTenantId()));
    }

    @Transactional(readOnly = true)
    public Claim get(UUID claimId, TenantScope scope) {
        Claim claim = persistence.findById(claimId)
            .orElseThrow(() -> new ClaimNotFoundException(claimId));
        return tenantGuard.check(scope, ENTITY_TYPE, claim);
    }

    @Transactional(readOnly = true)
    public List<Claim> listForSubject(UUID subjectId, TenantScope scope) {
        return persistence.findBySubject(scope.tenantId(), subjectId);
    }

    @Transactional(readOnly = true)
    public List<Claim> listByStatus(ClaimStatus status, TenantScope scope) {
        return persistence.findByStatus(scope.tenantId(), status);
    }

    /**
     * Review queue, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Claim> listPending(TenantScope scope) {
        return listByStatus(ClaimStatus.PENDING, scope);
    }

    private Claim reject(Claim claim, DecideClaimRequest request) {
        Claim rejected = persistence.update(claim.reject(request.getReviewerId(), request.getRejectionReason(),
                request.getNotes(), clock.instant()));

        outboxService.saveEvent(AggregateType.CLAIM, rejected.getId(), rejected.getTenantId(),
                ClaimRejectedEvent.EVENT_TYPE, ClaimRejectedEvent.fromClaim(rejected));

        auditLogger.claimDecided(rejected.getTenantId(), rejected.getId(), request.getReviewerId(),
                ClaimOutcome.REJECT.name());
        metrics.recordClaimDecided(ClaimOutcome.REJECT.name(), rejected.getStatus().name());
        log.info("Claim rejected: claimId={}, reason={}", rejected.getId(), rejected.getRejectionReason());
        return rejected;
    }

    private ClaimResult approve(Claim claim, DecideClaimRequest request, TenantScope scope) {
        Instant now = clock.instant();

        Enrollment enrollment = enrollmentService.getForUpdate(claim.getEnrollmentId(), scope);
        Policy policy = catalogService.get(claim.getPolicyId(), scope);
        LedgerEntry linkedEntry = claim.getLedgerEntryId() != null
            ? ledgerService.findByIdForShare(claim.getLedgerEntryId(), scope)
            : null;
        tenantGuard.checkRelated(scope, enrollment, policy, linkedEntry);

        Instant since = windowStart(policy, now);
        BigDecimal amount = null;
        if (claim.isMonetary()) {
            amount = request.getApprovedAmount() != null
                ? request.getApprovedAmount()
                : validator.baseAmount(claim.getDetails(), linkedEntry);
        }

        ClaimCheck check = ClaimCheck.builder()
            .policy(policy)
            .enrollment(enrollment)
            .linkedEntry(linkedEntry)
            .subjectId(claim.getSubjectId())
            .details(claim.getDetails())
            .incidentDate(claim.getIncidentDate())
            .filedDate(claim.getFiledDate())
            .now(now)
            .claimsInWindow(persistence.countTowardsLimitSince(claim.getTenantId(), claim.getSubjectId(),
                    claim.getPolicyId(), since))
            .approvedInWindow(persistence.sumApprovedSince(claim.getTenantId(), claim.getSubjectId(),
                    claim.getPolicyId(), since))
            .approvedAmount(amount)
            .build();

        List<ClaimFailure> failures = validator.validateApproval(check);
        if (!failures.isEmpty()) {
            recordFailures(failures);
            metrics.recordClaimDecided(ClaimOutcome.APPROVE.name(), "FAILED");
            log.info("Claim approval refused: claimId={}, failures={}", claim.getId(), codes(failures));
            return ClaimResult.failed(claim, failures);
        }

        Claim approved = persistence.update(claim.approve(request.getReviewerId(), amount, request.getNotes(), now));
        outboxService.saveEvent(AggregateType.CLAIM, approved.getId(), approved.getTenantId(),
                ClaimApprovedEvent.EVENT_TYPE, ClaimApprovedEvent.fromClaim(approved));
        auditLogger.claimDecided(approved.getTenantId(), approved.getId(), request.getReviewerId(),
                ClaimOutcome.APPROVE.name());

        Claim result = approved.isMonetary() ? writePayout(approved, scope) : approved;

        metrics.recordClaimDecided(ClaimOutcome.APPROVE.name(), result.getStatus().name());
        log.info("Claim approved: claimId={}, amount={}, status={}", result.getId(), amount, result.getStatus());
        return ClaimResult.success(result);
    }

    private Claim writePayout(Claim approved, TenantScope scope) {
        LedgerEntry payout = ledgerService.append(AppendEntryRequest.builder()
            .tenantId(approved.getTenantId())
            .subjectId(approved.getSubjectId())
            .amount(approved.getApprovedAmount())
            .bucket(AccountBucket.CHECKING)
            .kind(EntryKind.PAYOUT)
            .description("Insurance claim payout: " + approved.getId())
            .idempotencyKey(PAYOUT_KEY_PREFIX + approved.getId())
            .build(), scope);

        Claim paid = persistence.update(approved.markPaid(payout.getId()));
        outboxService.saveEvent(AggregateType.CLAIM, paid.getId(), paid.getTenantId(),
                ClaimPaidEvent.EVENT_TYPE, ClaimPaidEvent.fromClaim(paid, payout.getCreatedAt()));

        auditLogger.payoutWritten(paid.getTenantId(), paid.getId(), payout.getId(), payout.getAmount());
        metrics.recordPayout(payout.getAmount());
        log.info("Claim payout written: claimId={}, payoutEntryId={}, amount={}",
                paid.getId(), payout.getId(), payout.getAmount());
        return paid;
    }

    private Claim lockClaim(UUID claimId, TenantScope scope) {
        Claim claim = persistence.findForUpdate(claimId)
            .orElseThrow(() -> new ClaimNotFoundException(claimId));
        return tenantGuard.check(scope, ENTITY_TYPE, claim);
    }

    private void auditAlreadyClaimed(TransactionAlreadyClaimedException e, TenantScope scope) {
        auditLogger.integrityViolation(e.getCode(), scope.tenantId(), "LedgerEntry", e.getLedgerEntryId(),
                "open or paid claim exists");
        metrics.recordIntegrityViolation(e.getCode());
    }

    private void recordFailures(List<ClaimFailure> failures) {
        failures.forEach(failure -> metrics.recordFailure(failure.getCode().name()));
    }

    private static List<ClaimFailureCode> codes(List<ClaimFailure> failures) {
        return failures.stream().map(ClaimFailure::getCode).toList();
    }

    private static Instant windowStart(Policy policy, Instant now) {
        ClaimPeriod period = policy.getMaxClaimsPeriod() != null ? policy.getMaxClaimsPeriod() : ClaimPeriod.MONTH;
        return period.windowStart(now);
    }
}
