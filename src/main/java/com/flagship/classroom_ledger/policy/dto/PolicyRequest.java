package com.flagship.classroom_ledger.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.policy.ChargeFrequency;
import com.flagship.classroom_ledger.policy.ClaimPeriod;
import com.flagship.classroom_ledger.policy.ClaimType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/**
 * Request body for creating a policy or replacing its terms.
 *
 * Omitted optional fields take the catalog defaults: 7 day waiting period,
 * 30 day claim window, 30 day repurchase cooldown, suspension after 7 unpaid
 * days, monthly claim period.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PolicyRequest {

    @NotBlank(message = "Policy code is required")
    @Size(max = 64, message = "Policy code must be at most 64 characters")
    @JsonProperty("policy_code")
    String policyCode;

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Premium is required")
    @DecimalMin(value = "0", message = "Premium must not be negative")
    @JsonProperty("premium")
    BigDecimal premium;

    @JsonProperty("charge_frequency")
    ChargeFrequency chargeFrequency;

    @JsonProperty("autopay")
    Boolean autopay;

    @JsonProperty("waiting_period_days")
    Integer waitingPeriodDays;

    @JsonProperty("max_claims_count")
    Integer maxClaimsCount;

    @JsonProperty("max_claims_period")
    ClaimPeriod maxClaimsPeriod;

    @JsonProperty("max_claim_amount")
    BigDecimal maxClaimAmount;

    @JsonProperty("max_payout_per_period")
    BigDecimal maxPayoutPerPeriod;

    @NotNull(message = "Claim type is required")
    @JsonProperty("claim_type")
    ClaimType claimType;

    @JsonProperty("no_repurchase_after_cancel")
    Boolean noRepurchaseAfterCancel;

    @JsonProperty("enable_repurchase_cooldown")
    Boolean enableRepurchaseCooldown;

    @JsonProperty("repurchase_wait_days")
    Integer repurchaseWaitDays;

    @JsonProperty("auto_suspend_nonpay_days")
    Integer autoSuspendNonpayDays;

    @JsonProperty("claim_time_limit_days")
    Integer claimTimeLimitDays;

    @JsonProperty("bundle_with_policy_ids")
    Set<UUID> bundleWithPolicyIds;

    @DecimalMin(value = "0", message = "Bundle discount percent must not be negative")
    @DecimalMax(value = "100", message = "Bundle discount percent must be at most 100")
    @JsonProperty("bundle_discount_percent")
    BigDecimal bundleDiscountPercent;

    @DecimalMin(value = "0", message = "Bundle discount amount must not be negative")
    @JsonProperty("bundle_discount_amount")
    BigDecimal bundleDiscountAmount;
}
