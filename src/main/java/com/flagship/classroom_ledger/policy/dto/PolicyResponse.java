package com.flagship.classroom_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.policy.ChargeFrequency;
import com.flagship.classroom_ledger.policy.ClaimPeriod;
import com.flagship.classroom_ledger.policy.ClaimType;
import com.flagship.classroom_ledger.policy.Policy;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

@Value
@Builder
public class PolicyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("policy_code")
    String policyCode;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("premium")
    BigDecimal premium;

    @JsonProperty("charge_frequency")
    ChargeFrequency chargeFrequency;

    @JsonProperty("autopay")
    boolean autopay;

    @JsonProperty("waiting_period_days")
    int waitingPeriodDays;

    @JsonProperty("max_claims_count")
    Integer maxClaimsCount;

    @JsonProperty("max_claims_period")
    ClaimPeriod maxClaimsPeriod;

    @JsonProperty("max_claim_amount")
    BigDecimal maxClaimAmount;

    @JsonProperty("max_payout_per_period")
    BigDecimal maxPayoutPerPeriod;

    @JsonProperty("claim_type")
    ClaimType claimType;

    @JsonProperty("claim_time_limit_days")
    int claimTimeLimitDays;

    @JsonProperty("bundle_with_policy_ids")
    Set<UUID> bundleWithPolicyIds;

    @JsonProperty("active")
    boolean active;

    public static PolicyResponse from(Policy policy) {
        return PolicyResponse.builder()
            .id(policy.getId())
            .policyCode(policy.getPolicyCode())
            .title(policy.getTitle())
            .description(policy.getDescription())
            .premium(policy.getPremium())
            .chargeFrequency(policy.getChargeFrequency())
            .autopay(policy.isAutopay())
            .waitingPeriodDays(policy.getWaitingPeriodDays())
            .maxClaimsCount(policy.getMaxClaimsCount())
            .maxClaimsPeriod(policy.getMaxClaimsPeriod())
            .maxClaimAmount(policy.getMaxClaimAmount())
            .maxPayoutPerPeriod(policy.getMaxPayoutPerPeriod())
            .claimType(policy.getClaimType())
            .claimTimeLimitDays(policy.getClaimTimeLimitDays())
            .bundleWithPolicyIds(policy.getBundleWithPolicyIds())
            .active(policy.isActive())
            .build();
    }
}
