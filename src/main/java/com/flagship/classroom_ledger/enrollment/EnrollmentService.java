package com.flagship.classroom_ledger.enrollment;

import com.flagship.classroom_ledger.enrollment.event.EnrollmentCancelledEvent;
import com.flagship.classroom_ledger.enrollment.event.EnrollmentCreatedEvent;
import com.flagship.classroom_ledger.exception.ConstraintViolations;
import com.flagship.classroom_ledger.ledger.AccountBucket;
import com.flagship.classroom_ledger.ledger.AppendEntryRequest;
import com.flagship.classroom_ledger.ledger.EntryKind;
import com.flagship.classroom_ledger.ledger.LedgerEntry;
import com.flagship.classroom_ledger.ledger.LedgerService;
import com.flagship.classroom_ledger.outbox.AggregateType;
import com.flagship.classroom_ledger.outbox.OutboxService;
import com.flagship.classroom_ledger.policy.Policy;
import com.flagship.classroom_ledger.policy.PolicyCatalogService;
import com.flagship.classroom_ledger.policy.PolicyInactiveException;
import com.flagship.classroom_ledger.tenant.TenantGuard;
import com.flagship.classroom_ledger.tenant.TenantScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Purchase, billing and cancellation of policy enrollments.
 *
 * Billing updates arrive from an external producer (see BillingEventConsumer)
 * and may race with claim decisions; both sides take the enrollment row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentService {

    static final String ACTIVE_ENROLLMENT_CONSTRAINT = "uq_enrollments_active";
    private static final String ENTITY_TYPE = "Enrollment";

    private final EnrollmentRepository enrollmentRepository;
    private final PolicyCatalogService catalogService;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;
    private final TenantGuard tenantGuard;
    private final Clock clock;

    /**
     * Buys a policy for a subject and charges the first premium in the same
     * transaction.
     *
     * @throws PolicyInactiveException if the policy was deactivated
     * @throws AlreadyEnrolledException if an active or suspended enrollment exists
     * @throws RepurchaseBlockedException if a past cancellation forbids buying again
     * @throws InsufficientFundsException if available checking money does not cover the premium
     */
    @Transactional
    public Enrollment enroll(UUID subjectId, UUID policyId, TenantScope scope) {
        Policy policy = catalogService.get(policyId, scope);
        if (!policy.isActive()) {
            throw new PolicyInactiveException(policyId);
        }

        if (enrollmentRepository.existsByTenantIdAndSubjectIdAndPolicyIdAndStatusIn(
                scope.tenantId(), subjectId, policyId, EnumSet.of(EnrollmentStatus.ACTIVE, EnrollmentStatus.SUSPENDED))) {
            throw new AlreadyEnrolledException(subjectId, policyId);
        }

        Instant now = clock.instant();
        checkRepurchaseAllowed(subjectId, policy, scope, now);

        UUID enrollmentId = UUID.randomUUID();
        BigDecimal premium = catalogService.premiumFor(policy, activePolicyIds(subjectId, scope));
        BigDecimal available = ledgerService.availableBalance(subjectId, AccountBucket.CHECKING, scope);
        if (available.compareTo(premium) < 0) {
            log.info("Enrollment refused, premium not covered: subjectId={}, policyId={}, available={}, premium={}",
                    subjectId, policyId, available, premium);
            throw new InsufficientFundsException(subjectId, available, premium);
        }
        UUID premiumEntryId = chargePremium(enrollmentId, subjectId, policy, premium, scope);

        Enrollment enrollment = Enrollment.create(enrollmentId, subjectId, policy, premiumEntryId, now);
        try {
            enrollmentRepository.saveAndFlush(EnrollmentEntity.fromDomain(enrollment));
        } catch (DataIntegrityViolationException e) {
            if (ConstraintViolations.isViolationOf(e, ACTIVE_ENROLLMENT_CONSTRAINT)) {
                throw new AlreadyEnrolledException(subjectId, policyId);
            }
            throw e;
        }

        outboxService.saveEvent(AggregateType.ENROLLMENT, enrollmentId, enrollment.getTenantId(),
                EnrollmentCreatedEvent.EVENT_TYPE, EnrollmentCreatedEvent.fromEnrollment(enrollment, premium));

        log.info("Enrollment created: enrollmentId={}, subjectId={}, policyId={}, premium={}, coverageStart={}",
                enrollmentId, subjectId, policyId, premium, enrollment.getCoverageStartDate());
        return enrollment;
    }

    /**
     * Premium paid: payment current, counter reset, next due date advanced.
     * A suspended enrollment becomes active again.
     */
    @Transactional
    public Enrollment recordPayment(UUID enrollmentId, TenantScope scope) {
        EnrollmentEntity entity = lockEntity(enrollmentId, scope);
        Enrollment current = entity.toDomain();
        Policy policy = catalogService.get(current.getPolicyId(), scope);

        Enrollment updated = current.recordPayment(clock.instant(), policy.getChargeFrequency().interval());
        entity.updateFromDomain(updated);
        enrollmentRepository.save(entity);

        if (current.getStatus() != updated.getStatus()) {
            log.info("Enrollment reactivated after payment: enrollmentId={}", enrollmentId);
        }
        log.debug("Payment recorded: enrollmentId={}, nextPaymentDue={}", enrollmentId, updated.getNextPaymentDue());
        return updated;
    }

    /**
     * Premium missed: payment no longer current, unpaid counter incremented;
     * suspends at the policy's threshold.
     */
    @Transactional
    public Enrollment markUnpaid(UUID enrollmentId, TenantScope scope) {
        EnrollmentEntity entity = lockEntity(enrollmentId, scope);
        Enrollment current = entity.toDomain();
        Policy policy = catalogService.get(current.getPolicyId(), scope);

        Enrollment updated = current.markUnpaid(policy.getAutoSuspendNonpayDays());
        entity.updateFromDomain(updated);
        enrollmentRepository.save(entity);

        if (updated.getStatus() == EnrollmentStatus.SUSPENDED && current.getStatus() != EnrollmentStatus.SUSPENDED) {
            log.warn("Enrollment suspended for non-payment: enrollmentId={}, daysUnpaid={}",
                    enrollmentId, updated.getDaysUnpaid());
        } else {
            log.debug("Payment missed: enrollmentId={}, daysUnpaid={}", enrollmentId, updated.getDaysUnpaid());
        }
        return updated;
    }

    /**
     * Terminal. A cancelled enrollment can never be reactivated; the subject
     * may buy the policy again unless its repurchase rules forbid it.
     */
    @Transactional
    public Enrollment cancel(UUID enrollmentId, TenantScope scope) {
        EnrollmentEntity entity = lockEntity(enrollmentId, scope);
        Enrollment cancelled = entity.toDomain().cancel(clock.instant());
        entity.updateFromDomain(cancelled);
        enrollmentRepository.save(entity);

        outboxService.saveEvent(AggregateType.ENROLLMENT, enrollmentId, cancelled.getTenantId(),
                EnrollmentCancelledEvent.EVENT_TYPE, EnrollmentCancelledEvent.fromEnrollment(cancelled));

        log.info("Enrollment cancelled: enrollmentId={}", enrollmentId);
        return cancelled;
    }

    @Transactional(readOnly = true)
    public Enrollment get(UUID enrollmentId, TenantScope scope) {
        Enrollment enrollment = enrollmentRepository.findById(enrollmentId)
            .map(EnrollmentEntity::toDomain)
            .orElseThrow(() -> new EnrollmentNotFoundException(enrollmentId));
        return tenantGuard.check(scope, ENTITY_TYPE, enrollment);
    }

    /**
     * Fresh read under a row lock, for claim decisions. Must run inside the
     * caller's transaction so the lock covers the decision's commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment getForUpdate(UUID enrollmentId, TenantScope scope) {
        return lockEntity(enrollmentId, scope).toDomain();
    }

    @Transactional(readOnly = true)
    public List<Enrollment> listForSubject(UUID subjectId, TenantScope scope) {
        return enrollmentRepository.findByTenantIdAndSubjectIdOrderByPurchaseDateDesc(scope.tenantId(), subjectId)
            .stream()
            .map(EnrollmentEntity::toDomain)
            .toList();
    }

    private List<UUID> activePolicyIds(UUID subjectId, TenantScope scope) {
        return enrollmentRepository.findByTenantIdAndSubjectIdAndStatus(scope.tenantId(), subjectId, EnrollmentStatus.ACTIVE)
            .stream()
            .map(EnrollmentEntity::getPolicyId)
            .toList();
    }

    private void checkRepurchaseAllowed(UUID subjectId, Policy policy, TenantScope scope, Instant now) {
        Optional<EnrollmentEntity> lastCancelled = enrollmentRepository
            .findFirstByTenantIdAndSubjectIdAndPolicyIdAndStatusOrderByCancelDateDesc(
                scope.tenantId(), subjectId, policy.getId(), EnrollmentStatus.CANCELLED);
        if (lastCancelled.isEmpty()) {
            return;
        }
        if (policy.isNoRepurchaseAfterCancel()) {
            throw new RepurchaseBlockedException(policy.getId(), null);
        }
        Instant cancelDate = lastCancelled.get().getCancelDate();
        if (policy.isEnableRepurchaseCooldown() && cancelDate != null) {
            Instant blockedUntil = cancelDate.plus(Duration.ofDays(policy.getRepurchaseWaitDays()));
            if (now.isBefore(blockedUntil)) {
                throw new RepurchaseBlockedException(policy.getId(), blockedUntil);
            }
        }
    }

    private UUID chargePremium(UUID enrollmentId, UUID subjectId, Policy policy, BigDecimal premium,
                               TenantScope scope) {
        if (premium.signum() == 0) {
            return null;
        }
        LedgerEntry entry = ledgerService.append(AppendEntryRequest.builder()
            .tenantId(policy.getTenantId())
            .subjectId(subjectId)
            .amount(premium.negate())
            .bucket(AccountBucket.CHECKING)
            .kind(EntryKind.INSURANCE_PREMIUM)
            .description("Insurance premium: " + policy.getTitle())
            .idempotencyKey("enrollment-premium:" + enrollmentId)
            .build(), scope);
        return entry.getId();
    }

    private EnrollmentEntity lockEntity(UUID enrollmentId, TenantScope scope) {
        EnrollmentEntity entity = enrollmentRepository.findByIdForUpdate(enrollmentId)
            .orElseThrow(() -> new EnrollmentNotFoundException(enrollmentId));
        tenantGuard.check(scope, ENTITY_TYPE, entity.toDomain());
        return entity;
    }
}
