package com.flagship.classroom_ledger.policy;

import com.flagship.classroom_ledger.tenant.TenantOwned;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * An insurance offering of one tenant.
 *
 * Nullable limits ({@code maxClaimsCount}, {@code maxClaimAmount},
 * {@code maxPayoutPerPeriod}) mean "no limit". Terms are frozen once a claim
 * exists; only {@code active} may still change.
 */
@Value
@Builder(toBuilder = true)
public class Policy implements TenantOwned {
    UUID id;
    UUID tenantId;
    String policyCode;
    String title;
    String description;
    BigDecimal premium;
    ChargeFrequency chargeFrequency;
    boolean autopay;
    int waitingPeriodDays;
    Integer maxClaimsCount;
    ClaimPeriod maxClaimsPeriod;
    BigDecimal maxClaimAmount;
    BigDecimal maxPayoutPerPeriod;
    ClaimType claimType;
    boolean noRepurchaseAfterCancel;
    boolean enableRepurchaseCooldown;
    int repurchaseWaitDays;
    int autoSuspendNonpayDays;
    int claimTimeLimitDays;
    Set<UUID> bundleWithPolicyIds;
    BigDecimal bundleDiscountPercent;
    BigDecimal bundleDiscountAmount;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public Policy deactivate(Instant now) {
        return toBuilder().active(false).updatedAt(now).build();
    }

    /**
     * Premium charged to a subject who already holds the given active
     * policies. When any of them is bundled with this policy the percent
     * discount applies first, then the fixed amount; never below zero.
     */
    public BigDecimal premiumFor(Collection<UUID> activePolicyIds) {
        BigDecimal price = premium;
        if (bundleWithPolicyIds == null || bundleWithPolicyIds.isEmpty()
                || activePolicyIds.stream().noneMatch(bundleWithPolicyIds::contains)) {
            return price;
        }
        if (bundleDiscountPercent != null && bundleDiscountPercent.signum() > 0) {
            BigDecimal discount = price.multiply(bundleDiscountPercent)
                    .divide(BigDecimal.valueOf(100), 4, RoundingMode.HALF_UP);
            price = price.subtract(discount);
        }
        if (bundleDiscountAmount != null && bundleDiscountAmount.signum() > 0) {
            price = price.subtract(bundleDiscountAmount);
        }
        return price.max(BigDecimal.ZERO);
    }

    /**
     * Term sanity problems that make a claim under this policy undecidable.
     * Checked when a claim is filed or decided, not when the policy is saved.
     */
    public List<String> termProblems() {
        List<String> problems = new ArrayList<>();
        if (waitingPeriodDays < 0) {
            problems.add("waiting period is negative");
        }
        if (claimTimeLimitDays < 0) {
            problems.add("claim time limit is negative");
        }
        if (maxClaimAmount != null && maxClaimAmount.signum() < 0) {
            problems.add("max claim amount is negative");
        }
        if (maxPayoutPerPeriod != null && maxPayoutPerPeriod.signum() < 0) {
            problems.add("max payout per period is negative");
        }
        if (maxClaimsCount != null && maxClaimsCount < 0) {
            problems.add("max claims count is negative");
        }
        if (claimType == null) {
            problems.add("claim type is missing");
        }
        return problems;
    }
}
