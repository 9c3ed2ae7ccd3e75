package com.flagship.classroom_ledger.claim.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class FulfillmentRequest {

    @NotNull(message = "Reviewer ID is required")
    @JsonProperty("reviewer_id")
    UUID reviewerId;

    @JsonCreator
    public FulfillmentRequest(@JsonProperty("reviewer_id") UUID reviewerId) {
        this.reviewerId = reviewerId;
    }
}
