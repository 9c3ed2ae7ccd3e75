package com.flagship.classroom_ledger.policy;

import com.flagship.classroom_ledger.claim.ClaimRepository;
import com.flagship.classroom_ledger.policy.dto.PolicyRequest;
import com.flagship.classroom_ledger.tenant.TenantGuard;
import com.flagship.classroom_ledger.tenant.TenantScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Read-mostly catalog of insurance offerings.
 *
 * Term sanity is not validated here; the claims engine reports broken terms
 * as a PolicyMisconfigured failure when a claim is filed or decided.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicyCatalogService {

    private static final String ENTITY_TYPE = "Policy";

    static final int DEFAULT_WAITING_PERIOD_DAYS = 7;
    static final int DEFAULT_CLAIM_TIME_LIMIT_DAYS = 30;
    static final int DEFAULT_REPURCHASE_WAIT_DAYS = 30;
    static final int DEFAULT_AUTO_SUSPEND_NONPAY_DAYS = 7;

    private final PolicyRepository policyRepository;
    private final ClaimRepository claimRepository;
    private final TenantGuard tenantGuard;
    private final Clock clock;

    /**
     * @throws PolicyNotFoundException if no such policy exists
     */
    @Transactional(readOnly = true)
    public Policy get(UUID policyId, TenantScope scope) {
        Policy policy = policyRepository.findById(policyId)
            .map(PolicyEntity::toDomain)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
        return tenantGuard.check(scope, ENTITY_TYPE, policy);
    }

    @Transactional(readOnly = true)
    public List<Policy> listActive(TenantScope scope) {
        return policyRepository.findByTenantIdAndActiveTrueOrderByTitleAsc(scope.tenantId())
            .stream()
            .map(PolicyEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Policy> listAll(TenantScope scope) {
        return policyRepository.findByTenantIdOrderByTitleAsc(scope.tenantId())
            .stream()
            .map(PolicyEntity::toDomain)
            .toList();
    }

    @Transactional
    public Policy create(PolicyRequest request, TenantScope scope) {
        if (policyRepository.existsByTenantIdAndPolicyCode(scope.tenantId(), request.getPolicyCode())) {
            throw new DuplicatePolicyCodeException(request.getPolicyCode());
        }

        Instant now = clock.instant();
        Policy policy = applyTerms(Policy.builder(), request)
            .id(UUID.randomUUID())
            .tenantId(scope.tenantId())
            .policyCode(request.getPolicyCode())
            .active(true)
            .createdAt(now)
            .updatedAt(now)
            .build();

        Policy saved = policyRepository.save(PolicyEntity.fromDomain(policy)).toDomain();
        log.info("Policy created: policyId={}, code={}, claimType={}",
                saved.getId(), saved.getPolicyCode(), saved.getClaimType());
        return saved;
    }

    /**
     * Replaces the terms of a policy that no claim references yet.
     *
     * @throws PolicyLockedException if any claim exists under the policy
     */
    @Transactional
    public Policy updateTerms(UUID policyId, PolicyRequest request, TenantScope scope) {
        PolicyEntity entity = policyRepository.findById(policyId)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
        Policy current = tenantGuard.check(scope, ENTITY_TYPE, entity.toDomain());

        if (claimRepository.existsByPolicyId(policyId)) {
            throw new PolicyLockedException(policyId);
        }

        Policy updated = applyTerms(current.toBuilder(), request)
            .updatedAt(clock.instant())
            .build();
        entity.updateFromDomain(updated);

        log.info("Policy terms updated: policyId={}", policyId);
        return policyRepository.save(entity).toDomain();
    }

    /**
     * Stops new purchases. Existing enrollments and claims are unaffected.
     * Allowed even when the policy is locked.
     */
    @Transactional
    public Policy deactivate(UUID policyId, TenantScope scope) {
        PolicyEntity entity = policyRepository.findById(policyId)
            .orElseThrow(() -> new PolicyNotFoundException(policyId));
        tenantGuard.check(scope, ENTITY_TYPE, entity.toDomain());

        entity.deactivate(clock.instant());
        log.info("Policy deactivated: policyId={}", policyId);
        return policyRepository.save(entity).toDomain();
    }

    /**
     * Premium for a subject who already holds active enrollments in
     * {@code activePolicyIds}.
     */
    public BigDecimal premiumFor(Policy policy, Collection<UUID> activePolicyIds) {
        return policy.premiumFor(activePolicyIds);
    }

    private static Policy.PolicyBuilder applyTerms(Policy.PolicyBuilder builder, PolicyRequest request) {
        return builder
            .title(request.getTitle())
            .description(request.getDescription())
            .premium(request.getPremium())
            .chargeFrequency(orDefault(request.getChargeFrequency(), ChargeFrequency.MONTHLY))
            .autopay(orDefault(request.getAutopay(), false))
            .waitingPeriodDays(orDefault(request.getWaitingPeriodDays(), DEFAULT_WAITING_PERIOD_DAYS))
            .maxClaimsCount(request.getMaxClaimsCount())
            .maxClaimsPeriod(orDefault(request.getMaxClaimsPeriod(), ClaimPeriod.MONTH))
            .maxClaimAmount(request.getMaxClaimAmount())
            .maxPayoutPerPeriod(request.getMaxPayoutPerPeriod())
            .claimType(request.getClaimType())
            .noRepurchaseAfterCancel(orDefault(request.getNoRepurchaseAfterCancel(), false))
            .enableRepurchaseCooldown(orDefault(request.getEnableRepurchaseCooldown(), false))
            .repurchaseWaitDays(orDefault(request.getRepurchaseWaitDays(), DEFAULT_REPURCHASE_WAIT_DAYS))
            .autoSuspendNonpayDays(orDefault(request.getAutoSuspendNonpayDays(), DEFAULT_AUTO_SUSPEND_NONPAY_DAYS))
            .claimTimeLimitDays(orDefault(request.getClaimTimeLimitDays(), DEFAULT_CLAIM_TIME_LIMIT_DAYS))
            .bundleWithPolicyIds(request.getBundleWithPolicyIds() != null
                    ? Set.copyOf(request.getBundleWithPolicyIds()) : Set.of())
            .bundleDiscountPercent(request.getBundleDiscountPercent())
            .bundleDiscountAmount(request.getBundleDiscountAmount());
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
