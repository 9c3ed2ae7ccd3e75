package com.flagship.classroom_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class EnrollRequest {

    @NotNull(message = "Subject ID is required")
    @JsonProperty("subject_id")
    UUID subjectId;

    @NotNull(message = "Policy ID is required")
    @JsonProperty("policy_id")
    UUID policyId;
}
