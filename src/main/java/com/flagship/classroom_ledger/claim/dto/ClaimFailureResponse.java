package com.flagship.classroom_ledger.claim.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.classroom_ledger.claim.ClaimFailure;
import com.flagship.classroom_ledger.claim.ClaimResult;
import lombok.Value;

import java.util.List;

/**
 * 422 body for a refused filing or decision. {@code claim} is present only
 * when a decision was refused and the claim stays PENDING.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClaimFailureResponse {

    @JsonProperty("error")
    String error;

    @JsonProperty("claim")
    ClaimResponse claim;

    @JsonProperty("failures")
    List<ClaimFailure> failures;

    public static ClaimFailureResponse from(String error, ClaimResult result) {
        return new ClaimFailureResponse(
            error,
            result.getClaim() != null ? ClaimResponse.from(result.getClaim()) : null,
            result.getFailures()
        );
    }
}
