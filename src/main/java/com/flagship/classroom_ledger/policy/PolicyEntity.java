package com.flagship.classroom_ledger.policy;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity for insurance_policies.
 *
 * No setters: terms change only through {@link #updateFromDomain}, which the
 * catalog calls after checking that no claim references the policy.
 */
@Entity
@Table(
    name = "insurance_policies",
    uniqueConstraints = @UniqueConstraint(name = "uq_policies_tenant_code", columnNames = {"tenant_id", "policy_code"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "policy_code", nullable = false, updatable = false, length = 64)
    private String policyCode;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal premium;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_frequency", nullable = false, length = 20)
    private ChargeFrequency chargeFrequency;

    @Column(nullable = false)
    private boolean autopay;

    @Column(name = "waiting_period_days", nullable = false)
    private int waitingPeriodDays;

    @Column(name = "max_claims_count")
    private Integer maxClaimsCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "max_claims_period", nullable = false, length = 20)
    private ClaimPeriod maxClaimsPeriod;

    @Column(name = "max_claim_amount", precision = 19, scale = 4)
    private BigDecimal maxClaimAmount;

    @Column(name = "max_payout_per_period", precision = 19, scale = 4)
    private BigDecimal maxPayoutPerPeriod;

    @Enumerated(EnumType.STRING)
    @Column(name = "claim_type", nullable = false, length = 30)
    private ClaimType claimType;

    @Column(name = "no_repurchase_after_cancel", nullable = false)
    private boolean noRepurchaseAfterCancel;

    @Column(name = "enable_repurchase_cooldown", nullable = false)
    private boolean enableRepurchaseCooldown;

    @Column(name = "repurchase_wait_days", nullable = false)
    private int repurchaseWaitDays;

    @Column(name = "auto_suspend_nonpay_days", nullable = false)
    private int autoSuspendNonpayDays;

    @Column(name = "claim_time_limit_days", nullable = false)
    private int claimTimeLimitDays;

    @Convert(converter = UuidSetConverter.class)
    @Column(name = "bundle_with_policy_ids", columnDefinition = "TEXT")
    private Set<UUID> bundleWithPolicyIds;

    @Column(name = "bundle_discount_percent", precision = 7, scale = 4)
    private BigDecimal bundleDiscountPercent;

    @Column(name = "bundle_discount_amount", precision = 19, scale = 4)
    private BigDecimal bundleDiscountAmount;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PolicyEntity fromDomain(Policy policy) {
        return new PolicyEntity(
            policy.getId(),
            policy.getTenantId(),
            policy.getPolicyCode(),
            policy.getTitle(),
            policy.getDescription(),
            policy.getPremium(),
            policy.getChargeFrequency(),
            policy.isAutopay(),
            policy.getWaitingPeriodDays(),
            policy.getMaxClaimsCount(),
            policy.getMaxClaimsPeriod(),
            policy.getMaxClaimAmount(),
            policy.getMaxPayoutPerPeriod(),
            policy.getClaimType(),
            policy.isNoRepurchaseAfterCancel(),
            policy.isEnableRepurchaseCooldown(),
            policy.getRepurchaseWaitDays(),
            policy.getAutoSuspendNonpayDays(),
            policy.getClaimTimeLimitDays(),
            policy.getBundleWithPolicyIds(),
            policy.getBundleDiscountPercent(),
            policy.getBundleDiscountAmount(),
            policy.isActive(),
            policy.getCreatedAt(),
            policy.getUpdatedAt()
        );
    }

    public Policy toDomain() {
        return Policy.builder()
            .id(id)
            .tenantId(tenantId)
            .policyCode(policyCode)
            .title(title)
            .description(description)
            .premium(premium)
            .chargeFrequency(chargeFrequency)
            .autopay(autopay)
            .waitingPeriodDays(waitingPeriodDays)
            .maxClaimsCount(maxClaimsCount)
            .maxClaimsPeriod(maxClaimsPeriod)
            .maxClaimAmount(maxClaimAmount)
            .maxPayoutPerPeriod(maxPayoutPerPeriod)
            .claimType(claimType)
            .noRepurchaseAfterCancel(noRepurchaseAfterCancel)
            .enableRepurchaseCooldown(enableRepurchaseCooldown)
            .repurchaseWaitDays(repurchaseWaitDays)
            .autoSuspendNonpayDays(autoSuspendNonpayDays)
            .claimTimeLimitDays(claimTimeLimitDays)
            .bundleWithPolicyIds(bundleWithPolicyIds != null ? Set.copyOf(bundleWithPolicyIds) : Set.of())
            .bundleDiscountPercent(bundleDiscountPercent)
            .bundleDiscountAmount(bundleDiscountAmount)
            .active(active)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies every mutable term. Identity, tenant, code and creation time
     * never change.
     */
    void updateFromDomain(Policy policy) {
        this.title = policy.getTitle();
        this.description = policy.getDescription();
        this.premium = policy.getPremium();
        this.chargeFrequency = policy.getChargeFrequency();
        this.autopay = policy.isAutopay();
        this.waitingPeriodDays = policy.getWaitingPeriodDays();
        this.maxClaimsCount = policy.getMaxClaimsCount();
        this.maxClaimsPeriod = policy.getMaxClaimsPeriod();
        this.maxClaimAmount = policy.getMaxClaimAmount();
        this.maxPayoutPerPeriod = policy.getMaxPayoutPerPeriod();
        this.claimType = policy.getClaimType();
        this.noRepurchaseAfterCancel = policy.isNoRepurchaseAfterCancel();
        this.enableRepurchaseCooldown = policy.isEnableRepurchaseCooldown();
        this.repurchaseWaitDays = policy.getRepurchaseWaitDays();
        this.autoSuspendNonpayDays = policy.getAutoSuspendNonpayDays();
        this.claimTimeLimitDays = policy.getClaimTimeLimitDays();
        this.bundleWithPolicyIds = policy.getBundleWithPolicyIds();
        this.bundleDiscountPercent = policy.getBundleDiscountPercent();
        this.bundleDiscountAmount = policy.getBundleDiscountAmount();
        this.active = policy.isActive();
        this.updatedAt = policy.getUpdatedAt();
    }

    void deactivate(Instant now) {
        this.active = false;
        this.updatedAt = now;
    }
}
